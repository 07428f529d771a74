package com.credit.card.fraud.scoring.features.stage;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticContextGeneratorTest {

    @Test
    void generate_shouldBeDeterministic_forSameSeedAndKey() {
        SyntheticContextGenerator.SyntheticContext first = new SyntheticContextGenerator(42L).generate("tx-100");
        SyntheticContextGenerator.SyntheticContext second = new SyntheticContextGenerator(42L).generate("tx-100");

        assertEquals(first, second);
    }

    @Test
    void generate_shouldStayWithinUniverse() {
        SyntheticContextGenerator generator = new SyntheticContextGenerator(7L);

        for (int i = 0; i < 200; i++) {
            SyntheticContextGenerator.SyntheticContext context = generator.generate("key-" + i);
            int merchant = Integer.parseInt(context.getMerchantId());
            int geo = Integer.parseInt(context.getGeoBucket());
            int account = Integer.parseInt(context.getAccountId());

            assertTrue(merchant >= 0 && merchant < SyntheticContextGenerator.MERCHANTS);
            assertTrue(geo >= 0 && geo < SyntheticContextGenerator.GEO_BUCKETS);
            assertTrue(account >= 0 && account < SyntheticContextGenerator.ACCOUNTS);
            assertTrue(Arrays.asList(SyntheticContextGenerator.DEVICE_TYPES).contains(context.getDeviceType()));
            assertTrue(context.getAccountAgeDays() >= 0
                    && context.getAccountAgeDays() < SyntheticContextGenerator.MAX_ACCOUNT_AGE_DAYS);
        }
    }

    @Test
    void accountAge_shouldMatchGeneratedContext_forSameAccount() {
        SyntheticContextGenerator generator = new SyntheticContextGenerator(42L);
        SyntheticContextGenerator.SyntheticContext context = generator.generate("tx-7");

        assertEquals(context.getAccountAgeDays(), generator.accountAge(context.getAccountId()));
    }

    @Test
    void accountAge_shouldBeStable_forExternalAccountIds() {
        SyntheticContextGenerator generator = new SyntheticContextGenerator(42L);

        assertEquals(generator.accountAge("ACC-XYZ"), generator.accountAge("ACC-XYZ"));
    }
}
