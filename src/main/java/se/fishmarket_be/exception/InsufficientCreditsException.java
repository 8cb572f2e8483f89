package se.fishmarket_be.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.PAYMENT_REQUIRED)
public class InsufficientCreditsException extends RuntimeException {

    private final Long userId;
    private final int required;

    public InsufficientCreditsException(Long userId, int required) {
        super(String.format("Insufficient boost credits for user %d: %d required", userId, required));
        this.userId = userId;
        this.required = required;
    }

    public Long getUserId() {
        return userId;
    }

    public int getRequired() {
        return required;
    }
}
