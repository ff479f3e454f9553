package io.github.suppierk.identity.cqrs;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.identity.domain.IdentityEvent;
import io.github.suppierk.identity.domain.Role;
import io.github.suppierk.identity.errors.AggregateNotFoundException;
import io.github.suppierk.identity.errors.ConcurrencyConflictException;
import io.github.suppierk.identity.errors.DomainValidationException;
import io.github.suppierk.identity.es.EventCodec;
import io.github.suppierk.identity.es.EventStore;
import io.github.suppierk.identity.es.InMemoryEventStore;
import io.github.suppierk.identity.es.StoredEvent;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainCommandHandlerTest {
  static final EventCodec CODEC = new EventCodec();

  EventStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryEventStore();
  }

  record CreateTestRole(UUID messageId, Instant createdAt, String code)
      implements DomainCommand.Create<UUID, Instant> {
    CreateTestRole(final String code) {
      this(UUID.randomUUID(), Instant.now(), code);
    }
  }

  record RenameTestRole(UUID messageId, Instant createdAt, UUID aggregateId, String name)
      implements DomainCommand.Update<UUID, Instant> {
    RenameTestRole(final UUID aggregateId, final String name) {
      this(UUID.randomUUID(), Instant.now(), aggregateId, name);
    }
  }

  record DeleteTestRole(UUID messageId, Instant createdAt, UUID aggregateId)
      implements DomainCommand.Delete<UUID, Instant> {
    DeleteTestRole(final UUID aggregateId) {
      this(UUID.randomUUID(), Instant.now(), aggregateId);
    }
  }

  static class CreateHandler extends DomainCommandHandler.Create<CreateTestRole> {
    CreateHandler(final Class<CreateTestRole> commandClass) {
      super(commandClass);
    }

    @Override
    protected IdentityEvent decide(final CreateTestRole command, final UUID aggregateId) {
      return Role.create(aggregateId, null, "Test", command.code(), null);
    }
  }

  static final class RenameHandler extends DomainCommandHandler.Update<RenameTestRole, Role> {
    RenameHandler() {
      super(RenameTestRole.class, Role.empty());
    }

    @Override
    protected IdentityEvent decide(final RenameTestRole command, final Role state) {
      return state.update(command.name(), null);
    }
  }

  static final class DeleteHandler extends DomainCommandHandler.Delete<DeleteTestRole, Role> {
    DeleteHandler() {
      super(DeleteTestRole.class, Role.empty());
    }

    @Override
    protected IdentityEvent decide(final DeleteTestRole command, final Role state) {
      return state.delete();
    }
  }

  UUID createRole() {
    return new CreateHandler(CreateTestRole.class)
        .runInContext(new CreateTestRole("test"), store, CODEC);
  }

  @Nested
  class Create {
    @Test
    void when_command_class_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new CreateHandler(null));
    }

    @Test
    void when_command_class_is_present_it_must_be_not_null() {
      final var handler = assertDoesNotThrow(() -> new CreateHandler(CreateTestRole.class));
      assertEquals(CreateTestRole.class, handler.getCommandClass());
    }

    @Test
    void when_command_or_collaborators_are_null_exceptions_are_thrown() {
      final var handler = new CreateHandler(CreateTestRole.class);
      final var command = new CreateTestRole("test");

      assertThrows(IllegalArgumentException.class, () -> handler.runInContext(null, store, CODEC));
      assertThrows(IllegalStateException.class, () -> handler.runInContext(command, null, CODEC));
      assertThrows(IllegalStateException.class, () -> handler.runInContext(command, store, null));
    }

    @Test
    void when_creation_succeeds_then_one_event_is_appended_at_sequence_one() {
      final var roleId = createRole();

      final List<StoredEvent> events = store.load(roleId);
      assertEquals(1, events.size());
      assertEquals(1L, events.get(0).sequence());
    }

    @Test
    void when_creation_is_rejected_then_nothing_is_appended() {
      final var appends = new AtomicInteger();
      final EventStore countingStore =
          new EventStore() {
            @Override
            public void append(
                UUID aggregateId, List<? extends IdentityEvent> events, long expectedVersion) {
              appends.incrementAndGet();
              store.append(aggregateId, events, expectedVersion);
            }

            @Override
            public List<StoredEvent> load(UUID aggregateId) {
              return store.load(aggregateId);
            }
          };

      final var handler = new CreateHandler(CreateTestRole.class);
      assertThrows(
          DomainValidationException.class,
          () -> handler.runInContext(new CreateTestRole("not valid"), countingStore, CODEC));
      assertEquals(0, appends.get());
    }

    @Test
    void when_new_aggregate_id_is_already_used_then_conflict_is_thrown() {
      final var fixedId = UUID.randomUUID();
      final var handler =
          new CreateHandler(CreateTestRole.class) {
            @Override
            protected UUID newAggregateId(final CreateTestRole command) {
              return fixedId;
            }
          };

      assertEquals(fixedId, handler.runInContext(new CreateTestRole("first"), store, CODEC));
      assertThrows(
          ConcurrencyConflictException.class,
          () -> handler.runInContext(new CreateTestRole("second"), store, CODEC));
      assertEquals(1, store.load(fixedId).size());
    }
  }

  @Nested
  class Update {
    @Test
    void when_update_succeeds_then_version_after_the_command_is_returned() {
      final var roleId = createRole();
      final var handler = new RenameHandler();

      assertEquals(2L, handler.runInContext(new RenameTestRole(roleId, "Renamed"), store, CODEC));
      assertEquals(3L, handler.runInContext(new RenameTestRole(roleId, "Again"), store, CODEC));
      assertEquals("Again", Role.fromEvents(CODEC.decodeAll(store.load(roleId))).name());
    }

    @Test
    void when_stream_does_not_exist_then_aggregate_not_found_is_thrown() {
      final var handler = new RenameHandler();

      assertThrows(
          AggregateNotFoundException.class,
          () -> handler.runInContext(new RenameTestRole(UUID.randomUUID(), "x"), store, CODEC));
    }

    @Test
    void when_aggregate_id_is_null_then_illegal_state_is_thrown() {
      final var handler = new RenameHandler();

      assertThrows(
          IllegalStateException.class,
          () -> handler.runInContext(new RenameTestRole(null, "x"), store, CODEC));
    }

    @Test
    void when_another_writer_appends_between_load_and_append_then_conflict_is_thrown() {
      final var roleId = createRole();
      final EventStore interleavingStore =
          new EventStore() {
            @Override
            public void append(
                UUID aggregateId, List<? extends IdentityEvent> events, long expectedVersion) {
              store.append(
                  aggregateId, List.of(new IdentityEvent.RoleUpdated(aggregateId, "Racer", null)),
                  expectedVersion);
              store.append(aggregateId, events, expectedVersion);
            }

            @Override
            public List<StoredEvent> load(UUID aggregateId) {
              return store.load(aggregateId);
            }
          };

      assertThrows(
          ConcurrencyConflictException.class,
          () ->
              new RenameHandler()
                  .runInContext(new RenameTestRole(roleId, "Mine"), interleavingStore, CODEC));

      final var role = Role.fromEvents(CODEC.decodeAll(store.load(roleId)));
      assertEquals("Racer", role.name());
      assertEquals(2L, role.version());
    }
  }

  @Nested
  class Delete {
    @Test
    void when_deletion_succeeds_then_deletion_fact_is_appended() {
      final var roleId = createRole();

      assertEquals(2L, new DeleteHandler().runInContext(new DeleteTestRole(roleId), store, CODEC));

      final var role = Role.fromEvents(CODEC.decodeAll(store.load(roleId)));
      assertTrue(role.deleted());
      assertNotNull(role.code());
    }
  }
}
