package com.clinic.records.entity;

/**
 * Relationship of a patient to the primary member of the family sharing its mobile number.
 */
public enum Relationship {
    SELF, SPOUSE, CHILD, PARENT, SIBLING, GRANDPARENT, GRANDCHILD, OTHER
}
