package io.changefeed.model;

import io.changefeed.spi.RawChange;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeEventTest {

  @Test
  void insertCarriesNewRow() {
    ChangeEvent event = ChangeEvent.from(new RawChange("INSERT", "likes", null, Map.of("id", 1)), "likes");

    ChangeEvent.Insert insert = assertInstanceOf(ChangeEvent.Insert.class, event);
    assertEquals("likes", insert.table());
    assertEquals(1, insert.after().get("id"));
    assertEquals(EventKind.INSERT, insert.kind());
  }

  @Test
  void updateWithoutOldRowHasEmptyBefore() {
    ChangeEvent event = ChangeEvent.from(new RawChange("update", "posts", null, Map.of("id", 7)), null);

    ChangeEvent.Update update = assertInstanceOf(ChangeEvent.Update.class, event);
    assertTrue(update.before().columns().isEmpty());
    assertEquals(7, update.after().get("id"));
  }

  @Test
  void deleteCarriesOldRow() {
    ChangeEvent event = ChangeEvent.from(new RawChange("DELETE", "likes", Map.of("id", 3), null), "likes");

    ChangeEvent.Delete delete = assertInstanceOf(ChangeEvent.Delete.class, event);
    assertEquals(3, delete.before().get("id"));
  }

  @Test
  void rowsMayContainNullColumns() {
    Map<String, Object> row = new HashMap<>();
    row.put("id", 1);
    row.put("deleted_at", null);

    ChangeEvent.Insert insert = (ChangeEvent.Insert) ChangeEvent.from(new RawChange("INSERT", "t", null, row), "t");

    assertTrue(insert.after().has("deleted_at"));
    assertNull(insert.after().getString("deleted_at"));
  }

  @Test
  void singleEventIsItsOwnDelivery() {
    ChangeEvent event = ChangeEvent.from(new RawChange("INSERT", "t", null, Map.of()), "t");

    assertEquals(List.of(event), event.events());
    assertEquals(1, event.count());
  }

  @Test
  void rejectsUnknownEventType() {
    RawChange raw = new RawChange("TRUNCATE", "t", null, Map.of());

    MalformedChangeException e = assertThrows(MalformedChangeException.class, () -> ChangeEvent.from(raw, "t"));
    assertTrue(e.getMessage().contains("TRUNCATE"));
  }

  @Test
  void rejectsWildcardEventType() {
    assertThrows(MalformedChangeException.class,
        () -> ChangeEvent.from(new RawChange("*", "t", null, Map.of()), "t"));
  }

  @Test
  void rejectsMissingEventType() {
    assertThrows(MalformedChangeException.class,
        () -> ChangeEvent.from(new RawChange(null, "t", null, Map.of()), "t"));
  }

  @Test
  void rejectsInsertWithoutNewRow() {
    assertThrows(MalformedChangeException.class,
        () -> ChangeEvent.from(new RawChange("INSERT", "t", Map.of(), null), "t"));
  }

  @Test
  void rejectsDeleteWithoutOldRow() {
    assertThrows(MalformedChangeException.class,
        () -> ChangeEvent.from(new RawChange("DELETE", "t", null, Map.of()), "t"));
  }

  @Test
  void rejectsTableMismatch() {
    assertThrows(MalformedChangeException.class,
        () -> ChangeEvent.from(new RawChange("INSERT", "posts", null, Map.of()), "likes"));
  }

  @Test
  void rejectsMissingTable() {
    assertThrows(MalformedChangeException.class,
        () -> ChangeEvent.from(new RawChange("INSERT", null, null, Map.of()), null));
  }

  @Test
  void batchRequiresTwoEvents() {
    ChangeEvent event = ChangeEvent.from(new RawChange("INSERT", "t", null, Map.of()), "t");

    assertThrows(IllegalArgumentException.class, () -> new ChangeBatch(List.of(event)));

    ChangeBatch batch = new ChangeBatch(List.of(event, event));
    assertEquals("batch", batch.kind());
    assertEquals(2, batch.count());
    assertSame(event, batch.events().get(1));
  }
}
