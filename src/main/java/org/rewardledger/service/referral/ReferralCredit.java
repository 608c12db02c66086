package org.rewardledger.service.referral;

public record ReferralCredit(int level, String referrer, long amount) {}
