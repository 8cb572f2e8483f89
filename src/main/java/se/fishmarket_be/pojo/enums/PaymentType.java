package se.fishmarket_be.pojo.enums;

public enum PaymentType {
    MEMBERSHIP,
    BOOST
}
