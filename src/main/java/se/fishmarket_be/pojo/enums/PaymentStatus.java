package se.fishmarket_be.pojo.enums;

import java.util.Locale;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Maps the gateway's transaction status vocabulary onto ours.
     * Unknown or in-flight statuses stay {@link #PENDING}.
     */
    public static PaymentStatus fromGatewayStatus(String gatewayStatus) {
        if (gatewayStatus == null) {
            return PENDING;
        }
        return switch (gatewayStatus.trim().toLowerCase(Locale.ROOT)) {
            case "settlement", "capture" -> PAID;
            case "deny", "expire", "failure" -> FAILED;
            case "cancel" -> CANCELLED;
            default -> PENDING;
        };
    }
}
