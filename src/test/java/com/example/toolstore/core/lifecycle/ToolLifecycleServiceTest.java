package com.example.toolstore.core.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.toolstore.core.auth.AccessPolicy;
import com.example.toolstore.core.auth.ExactMatchCredentialVerifier;
import com.example.toolstore.core.config.ToolStoreProperties;
import com.example.toolstore.core.error.ForbiddenException;
import com.example.toolstore.core.error.PayloadValidationException;
import com.example.toolstore.core.error.RelationStoreException;
import com.example.toolstore.core.error.SchemaException;
import com.example.toolstore.core.error.ToolConflictException;
import com.example.toolstore.core.error.ToolNotFoundException;
import com.example.toolstore.core.error.UnauthorizedException;
import com.example.toolstore.core.paging.PageRequest;
import com.example.toolstore.core.registry.ToolRegistration;
import com.example.toolstore.core.registry.ToolRegistry;
import com.example.toolstore.core.relation.RelationDefinition;
import com.example.toolstore.core.relation.RelationStore;
import com.example.toolstore.core.relation.TableSynthesizer;
import com.example.toolstore.core.schema.PayloadValidator;
import com.example.toolstore.core.schema.SchemaField;
import com.example.toolstore.core.schema.SchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

@DisplayName("ToolLifecycleService")
class ToolLifecycleServiceTest {

    private static final String ADMIN = "admin-secret";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final List<SchemaField> SURVEY_SCHEMA = List.of(
            new SchemaField("user_id", "int"), new SchemaField("feedback", "str"));

    private final ObjectMapper om = new ObjectMapper();
    private final ToolRegistry registry = mock(ToolRegistry.class);
    private final RelationStore store = mock(RelationStore.class);
    private final TransactionTemplate transactions = mock(TransactionTemplate.class);

    @BeforeEach
    void runTransactionsInline() {
        doAnswer(invocation -> {
            invocation.<Consumer<TransactionStatus>>getArgument(0).accept(mock(TransactionStatus.class));
            return null;
        }).when(transactions).executeWithoutResult(any());
    }

    private ToolLifecycleService service(boolean lenient) {
        ToolStoreProperties properties = new ToolStoreProperties(
                new ToolStoreProperties.Auth(ADMIN, Map.of()), null, null,
                new ToolStoreProperties.Lifecycle(lenient));
        return new ToolLifecycleService(
                new SchemaValidator(),
                new PayloadValidator(),
                new TableSynthesizer(properties),
                registry,
                store,
                new AccessPolicy(new ExactMatchCredentialVerifier(), properties),
                transactions,
                Clock.fixed(NOW, ZoneOffset.UTC),
                properties);
    }

    private JsonNode json(String text) throws Exception {
        return om.readTree(text);
    }

    private void registered(String name) {
        ToolRegistration registration = new ToolRegistration(name, "t1", SURVEY_SCHEMA, NOW);
        when(registry.require(name)).thenReturn(registration);
        when(registry.lookup(name)).thenReturn(Optional.of(registration));
        when(registry.exists(name)).thenReturn(true);
    }

    @Test
    @DisplayName("registers the row and creates the table inside one transaction")
    void registerHappyPath() throws Exception {
        ToolRegistration result = service(false).register("survey", "t1",
                json("[{\"name\":\"user_id\",\"type\":\"int\"},{\"name\":\"feedback\",\"type\":\"str\"}]"), ADMIN);

        assertThat(result.schema()).isEqualTo(SURVEY_SCHEMA);
        assertThat(result.createdAt()).isEqualTo(NOW);
        InOrder order = inOrder(transactions, registry, store);
        order.verify(transactions).executeWithoutResult(any());
        order.verify(registry).register(result);
        ArgumentCaptor<RelationDefinition> relation = ArgumentCaptor.forClass(RelationDefinition.class);
        order.verify(store).createIfAbsent(relation.capture());
        assertThat(relation.getValue().tableName()).isEqualTo("tool_survey");
    }

    @Test
    @DisplayName("checks the admin credential before anything else")
    void registerRequiresAdmin() throws Exception {
        assertThatThrownBy(() -> service(false).register("survey", "t1", json("[]"), "wrong"))
                .isInstanceOf(ForbiddenException.class);
        verifyNoInteractions(registry, store);
    }

    @Test
    @DisplayName("rejects an invalid schema without touching the store")
    void registerRejectsBadSchema() throws Exception {
        assertThatThrownBy(() -> service(false).register("survey", "t1",
                json("[{\"name\":\"x\",\"type\":\"money\"}]"), ADMIN))
                .isInstanceOf(SchemaException.class);
        verifyNoInteractions(registry, store);
    }

    @Test
    @DisplayName("reports a conflict for a name that is already registered")
    void registerConflict() throws Exception {
        when(registry.exists("dup")).thenReturn(true);

        assertThatThrownBy(() -> service(false).register("dup", "t1", json("[]"), ADMIN))
                .isInstanceOf(ToolConflictException.class);
        verify(registry, never()).register(any());
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("removes only its own registry row when table creation fails")
    void registerRollsBackOnCreateFailure() throws Exception {
        when(registry.register(any())).thenReturn("insert-1");
        doThrow(new RelationStoreException("boom", new RuntimeException()))
                .when(store).createIfAbsent(any());

        assertThatThrownBy(() -> service(false).register("survey", "t1", json("[]"), ADMIN))
                .isInstanceOf(RelationStoreException.class);
        verify(registry).discard("survey", "insert-1");
        verify(registry, never()).deregister(anyString());
    }

    @Test
    @DisplayName("skips row cleanup when the registry insert itself never happened")
    void registerFailureBeforeInsertLeavesRegistryAlone() throws Exception {
        doThrow(new RelationStoreException("boom", new RuntimeException()))
                .when(registry).register(any());

        assertThatThrownBy(() -> service(false).register("survey", "t1", json("[]"), ADMIN))
                .isInstanceOf(RelationStoreException.class);
        verify(registry, never()).discard(anyString(), anyString());
        verify(registry, never()).deregister(anyString());
    }

    @Test
    @DisplayName("stores only schema fields after validating the payload")
    void storeFiltersUnknownKeys() throws Exception {
        registered("survey");

        service(false).store("survey", "t1", json("{\"user_id\":101,\"feedback\":\"Great service!\",\"extra\":1}"));

        ArgumentCaptor<ObjectNode> values = ArgumentCaptor.forClass(ObjectNode.class);
        verify(store).insert(any(), values.capture());
        assertThat(values.getValue().has("extra")).isFalse();
        assertThat(values.getValue().get("user_id").asInt()).isEqualTo(101);
    }

    @Test
    @DisplayName("rejects a wrong token and a mistyped payload before inserting")
    void storeRejections() throws Exception {
        registered("survey");

        assertThatThrownBy(() -> service(false).store("survey", "nope", json("{\"user_id\":1}")))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> service(false).store("survey", "t1", json("{\"user_id\":\"not-an-int\"}")))
                .isInstanceOf(PayloadValidationException.class);
        verify(store, never()).insert(any(), any());
    }

    @Test
    @DisplayName("reports not-found when the tool vanished during a write")
    void storeAfterConcurrentDeregistration() throws Exception {
        registered("survey");
        doThrow(new RelationStoreException("no table", new RuntimeException()))
                .when(store).insert(any(), any());
        when(registry.exists("survey")).thenReturn(false);

        assertThatThrownBy(() -> service(false).store("survey", "t1", json("{\"user_id\":1}")))
                .isInstanceOf(ToolNotFoundException.class);
    }

    @Test
    @DisplayName("re-derives the relation from the registry row when reading")
    void readUsesRegisteredSchema() {
        registered("survey");
        when(store.selectPage(any(), any())).thenReturn(List.of());

        assertThat(service(false).read("survey", new PageRequest(10, 0))).isEmpty();

        ArgumentCaptor<RelationDefinition> relation = ArgumentCaptor.forClass(RelationDefinition.class);
        verify(store).selectPage(relation.capture(), any());
        assertThat(relation.getValue()).isEqualTo(new TableSynthesizer("tool_").synthesize("survey", SURVEY_SCHEMA));
    }

    @Test
    @DisplayName("drops the table before deleting the registry row")
    void deregisterOrder() {
        registered("survey");

        service(false).deregister("survey", ADMIN);

        InOrder order = inOrder(store, registry);
        order.verify(store).dropIfExists("tool_survey");
        order.verify(registry).deregister("survey");
    }

    @Test
    @DisplayName("keeps the registry row when the drop fails")
    void deregisterFailsOnDropError() {
        registered("survey");
        doThrow(new RelationStoreException("locked", new RuntimeException())).when(store).dropIfExists(anyString());

        assertThatThrownBy(() -> service(false).deregister("survey", ADMIN))
                .isInstanceOf(RelationStoreException.class);
        verify(registry, never()).deregister(anyString());
    }

    @Test
    @DisplayName("lenient deregistration deletes the row despite a drop failure")
    void lenientDeregistration() {
        registered("survey");
        doThrow(new RelationStoreException("locked", new RuntimeException())).when(store).dropIfExists(anyString());

        service(true).deregister("survey", ADMIN);

        verify(registry).deregister("survey");
    }

    @Test
    @DisplayName("deregistration of an unknown tool is not found")
    void deregisterUnknown() {
        when(registry.require("ghost")).thenThrow(new ToolNotFoundException("Tool not found: ghost"));

        assertThatThrownBy(() -> service(false).deregister("ghost", ADMIN))
                .isInstanceOf(ToolNotFoundException.class);
        verifyNoInteractions(store);
    }
}
