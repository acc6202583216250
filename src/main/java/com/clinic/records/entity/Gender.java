package com.clinic.records.entity;

public enum Gender {
    MALE, FEMALE, OTHER, PREFER_NOT_TO_SAY
}
