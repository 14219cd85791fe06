package com.asiainfo.deepdive.core.engine;

import com.asiainfo.deepdive.core.model.ComparisonRecord;
import com.asiainfo.deepdive.core.model.DisplayTier;
import com.asiainfo.deepdive.core.model.LifecycleStatus;
import com.asiainfo.deepdive.core.model.Tier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.asiainfo.deepdive.support.Fixtures.existing;
import static com.asiainfo.deepdive.support.Fixtures.lost;
import static com.asiainfo.deepdive.support.Fixtures.newEntity;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TierClassifier 单元测试
 */
class TierClassifierTest {

    private final TierClassifier classifier = new TierClassifier();

    private Map<String, Tier> tiers(List<ComparisonRecord> records) {
        return classifier.classify(records).stream()
                .collect(Collectors.toMap(ComparisonRecord::entityId, ComparisonRecord::tier));
    }

    @Test
    void testSingleEntityIsA() {
        assertEquals(Tier.A, tiers(List.of(existing("1", 500, 1000))).get("1"));
    }

    @Test
    void testEightyFifteenFive() {
        Map<String, Tier> t = tiers(List.of(
                existing("x", 100, 800),
                existing("y", 100, 150),
                existing("z", 100, 50)));

        assertEquals(Tier.A, t.get("x"));
        assertEquals(Tier.B, t.get("y"));
        assertEquals(Tier.C, t.get("z"));
    }

    @Test
    void testEntityCrossingThresholdCompletesTier() {
        // 700 -> 70%，200 使累计跨过 80%，仍属于 A
        Map<String, Tier> t = tiers(List.of(
                existing("a", 1, 700),
                existing("b", 1, 200),
                existing("c", 1, 100)));

        assertEquals(Tier.A, t.get("a"));
        assertEquals(Tier.A, t.get("b"));
        assertEquals(Tier.B, t.get("c"));
    }

    @Test
    void testNewAndLostPrefixes() {
        Map<String, Tier> t = tiers(List.of(
                existing("e", 100, 900),
                newEntity("n", 100),
                lost("l1", 300),
                lost("l2", 10)));

        assertEquals(Tier.A, t.get("e"));
        assertEquals(Tier.NEW_B, t.get("n"));
        assertEquals(Tier.LOST_A, t.get("l1"));
        assertEquals(Tier.LOST_C, t.get("l2"));
        assertEquals("NEW-B", t.get("n").label());
        assertEquals(DisplayTier.LOST, t.get("l1").displayTier());
    }

    @Test
    void testZeroTotalGivesC() {
        Map<String, Tier> t = tiers(List.of(existing("a", 10, 0), existing("b", 10, 0)));

        assertEquals(Tier.C, t.get("a"));
        assertEquals(Tier.C, t.get("b"));
    }

    @Test
    void testZeroRevenueInPositiveGroupIsC() {
        Map<String, Tier> t = tiers(List.of(existing("a", 10, 100), existing("b", 10, 0)));

        assertEquals(Tier.A, t.get("a"));
        assertEquals(Tier.C, t.get("b"));
    }

    @Test
    void testTiesBrokenByEntityId() {
        List<ComparisonRecord> result = classifier.classify(List.of(
                existing("b", 1, 100), existing("a", 1, 100), existing("c", 1, 100)));

        assertEquals(List.of("a", "b", "c"), result.stream().map(ComparisonRecord::entityId).toList());
        assertEquals(Tier.A, result.get(0).tier());
        assertEquals(Tier.A, result.get(1).tier());
        assertEquals(Tier.A, result.get(2).tier());
    }

    @Test
    void testCumulativeShare() {
        List<ComparisonRecord> result = classifier.classify(List.of(
                existing("x", 1, 800), existing("y", 1, 150), existing("z", 1, 50)));

        assertEquals(80.0, result.get(0).cumulativeSharePct(), 1e-9);
        assertEquals(95.0, result.get(1).cumulativeSharePct(), 1e-9);
        assertEquals(100.0, result.get(2).cumulativeSharePct(), 1e-9);
    }

    @Test
    void testEmptyInput() {
        assertTrue(classifier.classify(List.of()).isEmpty());
    }

    @Test
    void testCoverageAndMonotonicity() {
        Random random = new Random(42);
        for (int round = 0; round < 50; round++) {
            List<ComparisonRecord> input = new ArrayList<>();
            int size = 1 + random.nextInt(40);
            for (int i = 0; i < size; i++) {
                String id = "e" + i;
                double p1 = random.nextInt(4) == 0 ? 0 : random.nextInt(1000);
                double p2 = random.nextInt(1000);
                switch (random.nextInt(3)) {
                    case 0 -> input.add(newEntity(id, p2));
                    case 1 -> input.add(lost(id, p1 + 1));
                    default -> input.add(existing(id, p1 + 1, p2));
                }
            }

            List<ComparisonRecord> result = classifier.classify(input);
            assertEquals(input.size(), result.size());

            Map<String, ComparisonRecord> byId = result.stream()
                    .collect(Collectors.toMap(ComparisonRecord::entityId, Function.identity()));
            for (ComparisonRecord r : result) {
                assertNotNull(r.tier(), "every record gets exactly one tier");
                assertEquals(r.lifecycleStatus(), r.tier().status());
            }

            // 同一排名组内，收入更高的实体层级不会更低
            for (ComparisonRecord a : result) {
                for (ComparisonRecord b : result) {
                    boolean sameGroup = (a.lifecycleStatus() == LifecycleStatus.LOST)
                            == (b.lifecycleStatus() == LifecycleStatus.LOST);
                    if (sameGroup && a.rankingRevenue() > b.rankingRevenue()) {
                        assertTrue(byId.get(a.entityId()).tier().rank().compareTo(b.tier().rank()) <= 0,
                                a + " vs " + b);
                    }
                }
            }
        }
    }
}
