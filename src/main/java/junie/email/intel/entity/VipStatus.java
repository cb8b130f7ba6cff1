package junie.email.intel.entity;

public enum VipStatus {
    ACTIVE,
    /** Learned promotion waiting for the user to accept it. */
    SUGGESTED,
    DISABLED
}
