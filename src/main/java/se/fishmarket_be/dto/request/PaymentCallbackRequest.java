package se.fishmarket_be.dto.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;
import se.fishmarket_be.exception.BusinessLogicException;

/**
 * Gateway notification as received. The body is kept byte for byte in {@code rawPayload};
 * the payment reference and status are read from it without rewriting anything.
 * <p>
 * The payment reference is our own id, which the gateway echoes as {@code order_id}. The
 * gateway's own {@code transaction_id} is only used when no {@code order_id} is sent.
 */
@Getter
@AllArgsConstructor
public class PaymentCallbackRequest {

    private static final String[] REFERENCE_KEYS = {"order_id", "orderId", "transactionId", "transaction_id"};
    private static final String[] STATUS_KEYS = {"transaction_status", "transactionStatus", "status"};

    private final String transactionId;
    private final String transactionStatus;
    private final String rawPayload;

    public static PaymentCallbackRequest parse(String rawPayload, ObjectMapper objectMapper) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw new BusinessLogicException("Notification body is required");
        }
        JsonNode body;
        try {
            body = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            throw new BusinessLogicException("Malformed notification body: " + e.getOriginalMessage());
        }
        if (body == null || !body.isObject()) {
            throw new BusinessLogicException("Notification body must be a JSON object");
        }

        String transactionId = firstText(body, REFERENCE_KEYS);
        if (transactionId == null) {
            throw new BusinessLogicException("Transaction ID is required");
        }
        String transactionStatus = firstText(body, STATUS_KEYS);
        if (transactionStatus == null) {
            throw new BusinessLogicException("Transaction status is required");
        }
        return new PaymentCallbackRequest(transactionId, transactionStatus, rawPayload);
    }

    private static String firstText(JsonNode body, String[] keys) {
        for (String key : keys) {
            JsonNode value = body.get(key);
            if (value != null && (value.isTextual() || value.isNumber()) && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
