package net.kairos.core.cron;

public class InvalidCronExpressionException extends IllegalArgumentException {
    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron expression [" + expression + "]: " + reason);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
