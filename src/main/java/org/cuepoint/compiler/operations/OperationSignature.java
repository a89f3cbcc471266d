package org.cuepoint.compiler.operations;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The signature of a built-in operation or of a controller.
 *
 * @param systemName The name used in source and in the emitted configuration.
 * @param parameters The parameters in positional order.
 */
public record OperationSignature(String systemName, List<OperationParameter> parameters) {

    public OperationSignature {
        parameters = List.copyOf(parameters);
    }

    /**
     * @return The number of required parameters.
     */
    public int requiredCount() {
        return (int) parameters.stream().filter(OperationParameter::required).count();
    }

    /**
     * @return The total number of parameters.
     */
    public int totalCount() {
        return parameters.size();
    }

    /**
     * @return A usage string listing required parameters first and optional ones in brackets,
     *         e.g. {@code animate(properties, animationDuration, [animationEasing])}.
     */
    public String usage() {
        String required = parameters.stream().filter(OperationParameter::required)
                .map(OperationParameter::name).collect(Collectors.joining(", "));
        String optional = parameters.stream().filter(p -> !p.required())
                .map(p -> "[" + p.name() + "]").collect(Collectors.joining(", "));
        String all = required.isEmpty() ? optional : (optional.isEmpty() ? required : required + ", " + optional);
        return systemName + "(" + all + ")";
    }

    /**
     * @return The expected argument count, e.g. {@code 2} or {@code 1-3}.
     */
    public String expectedCount() {
        int required = requiredCount();
        int total = totalCount();
        return required == total ? String.valueOf(required) : required + "-" + total;
    }
}
