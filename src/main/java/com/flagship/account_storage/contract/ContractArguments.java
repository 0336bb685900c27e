package com.flagship.account_storage.contract;

import java.util.List;

/**
 * Positional string arguments of one contract call, addressed by parameter name.
 */
public class ContractArguments {

    private final String function;
    private final List<String> parameters;
    private final List<String> values;

    ContractArguments(String function, List<String> parameters, List<String> values) {
        if (values.size() != parameters.size()) {
            throw new IllegalArgumentException(String.format(
                    "%s expects %d argument(s) %s but received %d",
                    function, parameters.size(), parameters, values.size()));
        }
        this.function = function;
        this.parameters = parameters;
        this.values = values;
    }

    public String text(String parameter) {
        return values.get(indexOf(parameter));
    }

    public long integer(String parameter) {
        String value = text(parameter);
        try {
            return Long.parseLong(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(
                    "%s argument '%s' must be an integer, got '%s'", function, parameter, value), e);
        }
    }

    private int indexOf(String parameter) {
        int index = parameters.indexOf(parameter);
        if (index < 0) {
            throw new IllegalStateException(function + " has no parameter " + parameter);
        }
        return index;
    }
}
