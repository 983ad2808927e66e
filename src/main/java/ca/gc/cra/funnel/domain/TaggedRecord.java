package ca.gc.cra.funnel.domain;

import java.util.Objects;

/**
 * Captured record paired with the id of the process that emitted it; the unit moved through a handoff
 * channel.
 *
 * @param originPid operating-system process id of the emitting JVM
 * @param record captured event
 * @since FUNNEL 0.1
 */
public record TaggedRecord(long originPid, CapturedRecord record) {
  public TaggedRecord {
    Objects.requireNonNull(record, "record");
  }
}
