package io.gamevault.state.engine;

import io.gamevault.state.model.StateKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ConflictAuditorTest {

    @Test
    void reportsEachPairTypeWithAffectedUsers() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-audit-")) {
            h.seedWishlist(1L, 10L, 100L);
            h.seedCollection(1L, 10L, 100L);
            h.seedWishlist(2L, 10L, 100L);
            h.seedCollection(2L, 10L, 100L);
            h.seedCollection(3L, 30L, 100L);
            h.seedProgress(3L, 30L, false, 100L);
            h.seedWishlist(4L, 40L, 100L);
            h.seedProgress(4L, 40L, true, 100L);
            h.seedWishlist(5L, 50L, 100L);

            ConflictAuditor.AuditReport report = h.auditor.audit(42L);

            Assertions.assertFalse(report.clean());
            Assertions.assertEquals(42L, report.checkedAtMs());
            Assertions.assertEquals(2, report.pairCount("Wishlist-Collection"));
            Assertions.assertEquals(List.of(1L, 2L), report.pairs().get("Wishlist-Collection").affectedUsers());
            Assertions.assertEquals(1, report.pairCount("Collection-Progress"));
            Assertions.assertEquals(1, report.pairCount("Wishlist-Progress"));
            Assertions.assertEquals(4, report.conflictingKeys());
        }
    }

    @Test
    void inertProgressRowsAreNotConflicts() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-audit-inert-")) {
            h.seedWishlist(1L, 10L, 100L);
            h.seedInertProgress(1L, 10L, 100L);

            ConflictAuditor.AuditReport report = h.auditor.audit(1L);

            Assertions.assertTrue(report.clean());
            Assertions.assertEquals(0, report.pairCount("Wishlist-Progress"));
        }
    }

    @Test
    void sameSetDuplicatesAreCountedSeparately() throws Exception {
        try (EngineHarness h = EngineHarness.create("gamevault-audit-dup-")) {
            h.seedWishlist(1L, 10L, 100L);
            h.seedWishlist(1L, 10L, 200L);

            ConflictAuditor.AuditReport report = h.auditor.audit(1L);

            Assertions.assertEquals(1, report.duplicates().get(StateKind.WISHLIST));
            Assertions.assertEquals(0, report.duplicates().get(StateKind.COLLECTION));
            Assertions.assertEquals(1, report.conflictingKeys());
        }
    }
}
