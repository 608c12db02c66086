package org.rewardledger.service.referral;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rewardledger.model.Account;
import org.rewardledger.model.LedgerEventType;
import org.rewardledger.service.AccountService;
import org.rewardledger.service.Identities;
import org.rewardledger.service.LedgerEventService;
import org.rewardledger.service.LedgerMath;
import org.rewardledger.service.LedgerSettings;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Remonte la chaîne de parrains et crédite à chaque niveau {@code reward * table[i] / 1000}
 * (toujours sur la récompense d'origine, sans composition).
 * Boucle bornée à 5 itérations : termine même sur une chaîne cyclique chargée par l'admin.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferralCascadeEngine {
    public static final int MAX_LEVELS = 5;

    private final AccountService accounts;
    private final LedgerEventService events;

    public List<ReferralCredit> distribute(String referee, String firstReferrer, long reward, LedgerSettings settings) {
        List<Integer> table = settings.referralPercents();
        int levels = Math.min(MAX_LEVELS, table.size());
        List<ReferralCredit> credits = new ArrayList<>(levels);

        String current = Identities.normalize(firstReferrer);
        for (int i = 0; i < levels; i++) {
            if (current == null) break; // chaîne plus courte : moins de niveaux crédités

            long credit = LedgerMath.mulDiv(reward, table.get(i), 1000);
            Account ref = accounts.getOrCreate(current);
            ref.setClaimableBalance(LedgerMath.add(ref.getClaimableBalance(), credit));
            ref.setReferralEarnings(LedgerMath.add(ref.getReferralEarnings(), credit));
            events.record(LedgerEventType.REFERRAL_REWARD, current, referee, credit, i + 1);
            credits.add(new ReferralCredit(i + 1, current, credit));
            log.debug("Referral level {} : {} credited {} (referee={})", i + 1, current, credit, referee);

            current = Identities.normalize(ref.getReferrer());
        }
        return credits;
    }
}
