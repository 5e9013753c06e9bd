package com.traceconform.core.routing;

import java.util.Optional;
import java.util.function.Function;

/**
 * One named attempt at coercing unrecognized model arguments into a supported shape.
 */
public record ModelConversion(String name, Function<Object[], Optional<ResolvedModel>> attempt) {

    public Optional<ResolvedModel> apply(Object[] modelArgs) {
        return attempt.apply(modelArgs);
    }
}
