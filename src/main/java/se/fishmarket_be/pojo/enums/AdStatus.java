package se.fishmarket_be.pojo.enums;

public enum AdStatus {
    DRAFT,
    ACTIVE,
    EXPIRED,
    REJECTED,
    DELETED
}
