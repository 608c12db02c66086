package org.rewardledger.model;

public enum Asset {
    TOKEN,
    STABLE
}
