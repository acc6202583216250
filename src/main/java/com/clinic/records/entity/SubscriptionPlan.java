package com.clinic.records.entity;

public enum SubscriptionPlan {
    TRIAL, BASIC, PREMIUM, ENTERPRISE
}
