package se.fishmarket_be.dto.request;

import jakarta.validation.groups.Default;

/**
 * Validation group for constraints that apply only when a resource is first created.
 */
public interface OnCreate extends Default {
}
