package ca.gc.cra.sift.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sift.domain.record.Partition;
import ca.gc.cra.sift.domain.record.RawRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class PartitionerTest {

  @Test
  void roundRobinAssignsRecordIToRankIModW() {
    List<RawRecord> records = IntStream.range(0, 7)
        .mapToObj(i -> RawRecord.of("line-" + i))
        .toList();

    List<Partition> partitions = new Partitioner(3).partition(records);

    assertEquals(3, partitions.size());
    assertEquals(List.of("line-0", "line-3", "line-6"), texts(partitions.get(0)));
    assertEquals(List.of("line-1", "line-4"), texts(partitions.get(1)));
    assertEquals(List.of("line-2", "line-5"), texts(partitions.get(2)));
  }

  @Test
  void partitionsAreDisjointAndCoverInput() {
    List<RawRecord> records = IntStream.range(0, 11)
        .mapToObj(i -> RawRecord.of("r" + i))
        .toList();

    List<Partition> partitions = new Partitioner(4).partition(records);

    List<String> seen = new ArrayList<>();
    partitions.forEach(p -> seen.addAll(texts(p)));
    assertEquals(11, seen.size());
    assertEquals(11, seen.stream().distinct().count());
  }

  @Test
  void everyRankSharesFirstRecordAsHeaderHint() {
    List<RawRecord> records = List.of(RawRecord.of("src_ip,label"), RawRecord.of("1.1.1.1,dos"));

    for (Partition partition : new Partitioner(4).partition(records)) {
      assertEquals(RawRecord.of("src_ip,label"), partition.headerHint().orElseThrow());
      assertEquals(4, partition.workerCount());
    }
  }

  @Test
  void moreRanksThanRecordsLeavesEmptyPartitions() {
    List<Partition> partitions = new Partitioner(4).partition(List.of(RawRecord.of("only")));

    assertEquals(1, partitions.get(0).size());
    assertTrue(partitions.get(3).records().isEmpty());
  }

  @Test
  void emptyInputHasNoHeaderHint() {
    List<Partition> partitions = new Partitioner(2).partition(List.of());

    assertTrue(partitions.stream().allMatch(p -> p.headerHint().isEmpty() && p.records().isEmpty()));
  }

  @Test
  void workerCountMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new Partitioner(0));
  }

  private static List<String> texts(Partition partition) {
    return partition.records().stream().map(RawRecord::text).toList();
  }
}
