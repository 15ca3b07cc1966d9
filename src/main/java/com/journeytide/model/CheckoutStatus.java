package com.journeytide.model;

public enum CheckoutStatus {
    OPEN,
    COMPLETED
}
