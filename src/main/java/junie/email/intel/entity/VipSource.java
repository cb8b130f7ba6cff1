package junie.email.intel.entity;

public enum VipSource {
    MANUAL,
    LEARNED
}
