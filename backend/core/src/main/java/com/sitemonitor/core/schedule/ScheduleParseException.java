package com.sitemonitor.core.schedule;

public class ScheduleParseException extends IllegalArgumentException {
    private final String expression;

    public ScheduleParseException(String expression, String reason) {
        super("Invalid schedule '" + expression + "': " + reason);
        this.expression = expression;
    }

    public ScheduleParseException(String expression, String reason, Throwable cause) {
        super("Invalid schedule '" + expression + "': " + reason, cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
