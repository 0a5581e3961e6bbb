package com.olap.bench.service.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.olap.bench.domain.Payload;
import com.olap.bench.domain.QueryRow;
import com.olap.bench.domain.QuerySet;

class PayloadPartitionerTest {

    private static QuerySet querySetOf(int size) {
        return QuerySet.ofInts("p", "Sum(Bitmap(frame=\"x\", rowID=%d), frame=\"y\")",
            List.of(IntStream.range(0, size).boxed().collect(Collectors.toList())));
    }

    private static List<Payload> partition(QuerySet querySet, int batchSize) {
        List<Payload> payloads = new ArrayList<>();
        new PayloadPartitioner(querySet, batchSize).forEachRemaining(payloads::add);
        return payloads;
    }

    @Test
    @DisplayName("17 queries in batches of 5 yield payloads of 5, 5, 5 and 2")
    void partition_ShouldLeaveShortLastPayload() {
        List<Payload> payloads = partition(querySetOf(17), 5);

        assertThat(payloads).extracting(Payload::size).containsExactly(5, 5, 5, 2);
        assertThat(payloads).extracting(Payload::sequence).containsExactly(0L, 1L, 2L, 3L);
        assertThat(PayloadPartitioner.payloadCount(17, 5)).isEqualTo(4);
    }

    @Test
    void partition_ShouldKeepAscendingContiguousIndices() {
        List<Payload> payloads = partition(querySetOf(17), 5);

        List<Long> indices = payloads.stream()
            .flatMap(payload -> payload.rows().stream())
            .map(QueryRow::index)
            .collect(Collectors.toList());

        assertThat(indices).containsExactlyElementsOf(
            IntStream.range(0, 17).mapToObj(Long::valueOf).collect(Collectors.toList()));
        assertThat(payloads.get(3).firstIndex()).isEqualTo(15);
        assertThat(payloads.get(3).lastIndex()).isEqualTo(16);
    }

    @Test
    void partition_ShouldJoinStatementsWithNewlines() {
        Payload payload = partition(querySetOf(3), 3).get(0);

        assertThat(payload.text()).isEqualTo(
            "Sum(Bitmap(frame=\"x\", rowID=0), frame=\"y\")\n"
            + "Sum(Bitmap(frame=\"x\", rowID=1), frame=\"y\")\n"
            + "Sum(Bitmap(frame=\"x\", rowID=2), frame=\"y\")");
    }

    @Test
    void partition_ShouldProduceSinglePayloadWhenBatchCoversSet() {
        assertThat(partition(querySetOf(17), 17)).hasSize(1);
        assertThat(partition(querySetOf(17), 100)).extracting(Payload::size).containsExactly(17);
    }

    @Test
    void partition_ShouldProduceNothingForEmptySet() {
        PayloadPartitioner partitioner = new PayloadPartitioner(querySetOf(0), 4);

        assertThat(partitioner.hasNext()).isFalse();
        assertThatThrownBy(partitioner::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void constructor_ShouldRejectBatchSizeBelowOne() {
        assertThatThrownBy(() -> new PayloadPartitioner(querySetOf(5), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Batch size");
    }
}
