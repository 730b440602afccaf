package io.shelfdb.client.operation;

import io.shelfdb.client.ContractViolationException;
import io.shelfdb.client.OperationRequest;
import io.shelfdb.client.RangeQuery;
import io.shelfdb.client.RecordFunction;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class OperationResolverTest {

    private static final RecordFunction ANY = record -> true;

    private static OperationRequest request(boolean key, boolean value, boolean index, boolean where, boolean query) {
        return OperationRequest.builder()
            .key(key ? 1 : null)
            .value(value ? Map.of("id", 1) : null)
            .index(index ? "userId" : null)
            .where(where ? ANY : null)
            .query(query ? RangeQuery.between(1, 9) : null)
            .build();
    }

    @Nested
    class Fetch {

        @Test
        void keyAloneIsLookup() {
            assertThat(OperationResolver.resolve(OperationKind.FETCH, OperationRequest.ofKey(1)))
                .isEqualTo(ResolvedOperation.KEY_LOOKUP);
        }

        @Test
        void nothingIsRangeScan() {
            assertThat(OperationResolver.resolve(OperationKind.FETCH, OperationRequest.empty()))
                .isEqualTo(ResolvedOperation.RANGE_SCAN);
        }

        @Test
        void keyWithIndexIsIndexLookup() {
            assertThat(OperationResolver.resolve(OperationKind.FETCH, request(true, false, true, false, false)))
                .isEqualTo(ResolvedOperation.INDEX_KEY_LOOKUP);
        }

        @Test
        void indexWithQueryIsIndexScan() {
            assertThat(OperationResolver.resolve(OperationKind.FETCH, request(false, false, true, false, true)))
                .isEqualTo(ResolvedOperation.INDEX_RANGE_SCAN);
        }

        @Test
        void whereAlwaysWalks() {
            assertThat(OperationResolver.resolve(OperationKind.FETCH, request(true, true, true, true, true)))
                .isEqualTo(ResolvedOperation.CURSOR_FETCH);
            assertThat(OperationResolver.resolve(OperationKind.FETCH, request(false, false, false, true, false)))
                .isEqualTo(ResolvedOperation.CURSOR_FETCH);
        }

        @Test
        void fetchNeverRejects() {
            for (int mask = 0; mask < 32; mask++) {
                OperationRequest request = fromMask(mask);
                assertThatCode(() -> OperationResolver.resolve(OperationKind.FETCH, request))
                    .doesNotThrowAnyException();
            }
        }
    }

    @Nested
    class Upsert {

        @Test
        void valueIsDirectWrite() {
            assertThat(OperationResolver.resolve(OperationKind.UPSERT, request(true, true, false, false, false)))
                .isEqualTo(ResolvedOperation.DIRECT_WRITE);
        }

        @Test
        void whereIsCursorUpdate() {
            assertThat(OperationResolver.resolve(OperationKind.UPSERT, request(false, true, true, true, false)))
                .isEqualTo(ResolvedOperation.CURSOR_UPDATE);
        }

        @Test
        void valueWithIndexIsRejected() {
            assertThatThrownBy(() -> OperationResolver.resolve(OperationKind.UPSERT, request(false, true, true, false, false)))
                .isInstanceOf(ContractViolationException.UnsupportedCombination.class)
                .hasMessageContaining("upsert")
                .hasMessageContaining("{value, index}");
        }

        @Test
        void missingValueIsRejected() {
            assertThatThrownBy(() -> OperationResolver.resolve(OperationKind.UPSERT, OperationRequest.ofKey(1)))
                .isInstanceOfSatisfying(ContractViolationException.UnsupportedCombination.class, e -> {
                    assertThat(e.kind()).isEqualTo(OperationKind.UPSERT);
                    assertThat(e.shape().key()).isTrue();
                });
        }
    }

    @Nested
    class Remove {

        @Test
        void keyIsDirectDelete() {
            assertThat(OperationResolver.resolve(OperationKind.REMOVE, OperationRequest.ofKey(1)))
                .isEqualTo(ResolvedOperation.DIRECT_DELETE);
        }

        @Test
        void whereIsCursorDelete() {
            assertThat(OperationResolver.resolve(OperationKind.REMOVE, request(true, false, false, true, false)))
                .isEqualTo(ResolvedOperation.CURSOR_DELETE);
        }

        @Test
        void nothingClears() {
            assertThat(OperationResolver.resolve(OperationKind.REMOVE, OperationRequest.empty()))
                .isEqualTo(ResolvedOperation.CLEAR);
        }

        @Test
        void indexWithoutWhereIsRejected() {
            assertThatThrownBy(() -> OperationResolver.resolve(OperationKind.REMOVE, request(true, false, true, false, false)))
                .isInstanceOf(ContractViolationException.UnsupportedCombination.class);
            assertThatThrownBy(() -> OperationResolver.resolve(OperationKind.REMOVE, request(false, false, true, false, false)))
                .isInstanceOf(ContractViolationException.UnsupportedCombination.class);
        }
    }

    @Nested
    class Add {

        @Test
        void valueIsInsert() {
            assertThat(OperationResolver.resolve(OperationKind.ADD, OperationRequest.ofValue(Map.of())))
                .isEqualTo(ResolvedOperation.INSERT);
        }

        @Test
        void whereIsRejected() {
            assertThatThrownBy(() -> OperationResolver.resolve(OperationKind.ADD, request(false, true, false, true, false)))
                .isInstanceOf(ContractViolationException.UnsupportedCombination.class);
        }
    }

    @Test
    void everyShapeResolvesToOneOperationOfItsKindOrIsRejected() {
        for (OperationKind kind : OperationKind.values()) {
            Set<ResolvedOperation> reached = EnumSet.noneOf(ResolvedOperation.class);
            for (int mask = 0; mask < 32; mask++) {
                OperationRequest request = fromMask(mask);
                try {
                    ResolvedOperation operation = OperationResolver.resolve(kind, request);
                    assertThat(operation.kind()).isEqualTo(kind);
                    assertThat(OperationResolver.resolve(kind, request)).isEqualTo(operation);
                    reached.add(operation);
                } catch (ContractViolationException.UnsupportedCombination e) {
                    assertThat(e.kind()).isEqualTo(kind);
                }
            }
            assertThat(reached)
                .as("operations reachable for %s", kind)
                .containsExactlyInAnyOrderElementsOf(operationsOf(kind));
        }
    }

    @Test
    void whereIgnoresKeyAndValue() {
        for (OperationKind kind : EnumSet.of(OperationKind.FETCH, OperationKind.UPSERT, OperationKind.REMOVE)) {
            ResolvedOperation bare = OperationResolver.resolve(kind, OperationRequest.matching(ANY));
            ResolvedOperation loaded = OperationResolver.resolve(kind, request(true, true, false, true, false));

            assertThat(loaded).isEqualTo(bare);
            assertThat(bare.usesCursor()).isTrue();
        }
    }

    private static OperationRequest fromMask(int mask) {
        return request((mask & 1) != 0, (mask & 2) != 0, (mask & 4) != 0, (mask & 8) != 0, (mask & 16) != 0);
    }

    private static Set<ResolvedOperation> operationsOf(OperationKind kind) {
        Set<ResolvedOperation> operations = EnumSet.noneOf(ResolvedOperation.class);
        for (ResolvedOperation operation : ResolvedOperation.values()) {
            if (operation.kind() == kind) {
                operations.add(operation);
            }
        }
        return operations;
    }
}
