package com.sitemonitor.service.notify;

public class DeliveryException extends RuntimeException {
    private final boolean invalidTarget;

    private DeliveryException(String message, boolean invalidTarget, Throwable cause) {
        super(message, cause);
        this.invalidTarget = invalidTarget;
    }

    public static DeliveryException invalidTarget(String message) {
        return new DeliveryException(message, true, null);
    }

    public static DeliveryException failed(String message) {
        return new DeliveryException(message, false, null);
    }

    public static DeliveryException failed(String message, Throwable cause) {
        return new DeliveryException(message, false, cause);
    }

    public boolean invalidTarget() {
        return invalidTarget;
    }
}
