// file: server/src/test/java/io/planbridge/server/provider/GrpcResourceProviderServiceTest.java
package io.planbridge.server.provider;

import com.google.protobuf.Struct;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.planbridge.core.render.Colorization;
import io.planbridge.core.value.ValueTree;
import io.planbridge.server.BridgeService;
import io.planbridge.server.backend.InMemoryResourceBackend;
import io.planbridge.server.codec.Sentinels;
import io.planbridge.server.codec.StructCodec;
import io.planbridge.server.schema.SchemaRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static io.planbridge.core.value.ValueTree.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GrpcResourceProviderService:
 *  - Check/Diff/Create/Update/Read/Delete go through BridgeService and the core engine.
 *  - Detailed diffs use the wire kinds and path text.
 *  - Failures map to INVALID_ARGUMENT, FAILED_PRECONDITION or INTERNAL.
 */
class GrpcResourceProviderServiceTest {

    private static final String TEST_URN = "urn:dev::demo::prov:index/test:Test::res";
    private static final String REPLACED_URN = "urn:dev::demo::prov:index/test:Replaced::db";

    private Server server;
    private ManagedChannel channel;
    private ResourceProviderGrpc.ResourceProviderBlockingStub stub;

    @BeforeEach
    void start() throws IOException {
        SchemaRegistry schemas = SchemaRegistry.fromClasspath("/test-schema.json");
        var bridge = new BridgeService(schemas, new InMemoryResourceBackend(schemas), Colorization.NEVER);

        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder
                .forName(name)
                .directExecutor()
                .addService(new GrpcResourceProviderService(bridge))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name)
                .directExecutor()
                .build();
        stub = ResourceProviderGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void stop() {
        channel.shutdownNow();
        server.shutdownNow();
    }

    private static Struct struct(ValueTree v) {
        return StructCodec.encodeStruct(v);
    }

    private ResourceProviderProto.DiffResponse diff(String urn, ValueTree olds, ValueTree news) {
        return stub.diff(ResourceProviderProto.DiffRequest.newBuilder()
                .setId("res-1")
                .setUrn(urn)
                .setOlds(struct(olds))
                .setNews(struct(news))
                .build());
    }

    @Test
    void diff_reports_positional_list_changes() {
        var resp = diff(TEST_URN,
                object("name", of("a"), "tests", list(of("val2"), of("val3"))),
                object("name", of("a"), "tests", list(of("val1"), of("val2"), of("val3"))));

        assertEquals(ResourceProviderProto.DiffResponse.DiffChanges.DIFF_SOME, resp.getChanges());
        assertTrue(resp.getHasDetailedDiff());
        assertEquals(3, resp.getDetailedDiffCount());
        assertEquals(ResourceProviderProto.PropertyDiff.Kind.UPDATE, resp.getDetailedDiffOrThrow("tests[0]").getKind());
        assertEquals(ResourceProviderProto.PropertyDiff.Kind.UPDATE, resp.getDetailedDiffOrThrow("tests[1]").getKind());
        assertEquals(ResourceProviderProto.PropertyDiff.Kind.ADD, resp.getDetailedDiffOrThrow("tests[2]").getKind());
        assertEquals(List.of("tests"), resp.getDiffsList());
        assertEquals(0, resp.getReplacesCount());
        assertTrue(resp.getStablesList().contains("name"));
        assertFalse(resp.getDeleteBeforeReplace());
        assertTrue(resp.getPreview().startsWith("~ prov:index/test:Test res (update)"), resp.getPreview());
    }

    @Test
    void diff_without_changes_is_diff_none() {
        var olds = object("name", of("a"), "tags", list(of("x"), of("y")));
        var news = object("name", of("a"), "tags", list(of("y"), of("x")));

        var resp = diff(TEST_URN, olds, news);

        assertEquals(ResourceProviderProto.DiffResponse.DiffChanges.DIFF_NONE, resp.getChanges());
        assertEquals(0, resp.getDetailedDiffCount());
    }

    @Test
    void force_new_set_change_replaces() {
        var resp = diff(TEST_URN,
                object("name", of("a"), "tags", list(of("val1"))),
                object("name", of("a"), "tags", list(of("val2"))));

        assertEquals(ResourceProviderProto.PropertyDiff.Kind.UPDATE_REPLACE, resp.getDetailedDiffOrThrow("tags[0]").getKind());
        assertEquals(List.of("tags"), resp.getReplacesList());
        assertFalse(resp.getStablesList().contains("tags"));
    }

    @Test
    void delete_before_replace_follows_resource_option() {
        var resp = diff(REPLACED_URN, object("name", of("a")), object("name", of("b")));

        assertEquals(ResourceProviderProto.PropertyDiff.Kind.UPDATE_REPLACE, resp.getDetailedDiffOrThrow("name").getKind());
        assertTrue(resp.getDeleteBeforeReplace());
    }

    @Test
    void replace_override_forces_meta_entry() {
        var resp = stub.diff(ResourceProviderProto.DiffRequest.newBuilder()
                .setUrn(TEST_URN)
                .setOlds(struct(object("name", of("a"))))
                .setNews(struct(object("name", of("a"))))
                .setReplaceOverride(ResourceProviderProto.ReplaceOverride.REPLACE_OVERRIDE_FORCE)
                .build());

        assertEquals(ResourceProviderProto.PropertyDiff.Kind.UPDATE_REPLACE, resp.getDetailedDiffOrThrow("__meta").getKind());
    }

    @Test
    void unknown_resource_type_is_invalid_argument() {
        var ex = assertThrows(StatusRuntimeException.class,
                () -> diff("urn:dev::demo::prov:index/nope:Nope::x", object(), object()));

        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
        assertTrue(ex.getStatus().getDescription().contains("unknown resource type"));
    }

    @Test
    void shape_mismatch_is_invalid_argument() {
        var ex = assertThrows(StatusRuntimeException.class,
                () -> diff(TEST_URN, object("name", of("a")), object("name", of("a"), "tests", of("x"))));

        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
        assertEquals("unexpected type at field tests", ex.getStatus().getDescription());
    }

    @Test
    void null_set_element_is_failed_precondition() {
        var ex = assertThrows(StatusRuntimeException.class,
                () -> diff(TEST_URN, object("name", of("a")), object("name", of("a"), "tags", list(of("x"), nil()))));

        assertEquals(Status.Code.FAILED_PRECONDITION, ex.getStatus().getCode());
    }

    @Test
    void check_reports_missing_required_property() {
        var resp = stub.check(ResourceProviderProto.CheckRequest.newBuilder()
                .setUrn(TEST_URN)
                .setNews(struct(object("tests", list(of("a")))))
                .build());

        assertEquals(1, resp.getFailuresCount());
        assertEquals("name", resp.getFailures(0).getProperty());
        assertEquals("missing required property name", resp.getFailures(0).getReason());
    }

    @Test
    void create_fills_computed_fields_and_marks_secrets() {
        var resp = stub.create(ResourceProviderProto.CreateRequest.newBuilder()
                .setUrn(TEST_URN)
                .setProperties(struct(object("name", of("a"), "password", of("p"))))
                .build());

        assertEquals("res-1", resp.getId());
        var props = resp.getProperties().getFieldsMap();
        assertEquals("res-1-id", props.get("id").getStringValue());
        var password = props.get("password").getStructValue().getFieldsMap();
        assertEquals(Sentinels.SECRET_SIG, password.get(Sentinels.SIG_KEY).getStringValue());
        assertEquals("p", password.get(Sentinels.VALUE_KEY).getStringValue());
    }

    @Test
    void create_preview_returns_unknown_computed_fields() {
        var resp = stub.create(ResourceProviderProto.CreateRequest.newBuilder()
                .setUrn(TEST_URN)
                .setProperties(struct(object("name", of("a"))))
                .setPreview(true)
                .build());

        assertEquals("", resp.getId());
        assertEquals(Sentinels.UNKNOWN, resp.getProperties().getFieldsMap().get("id").getStringValue());
    }

    @Test
    void update_keeps_secret_inputs_secret() {
        var created = stub.create(ResourceProviderProto.CreateRequest.newBuilder()
                .setUrn(TEST_URN)
                .setProperties(struct(object("name", of("a"))))
                .build());

        var resp = stub.update(ResourceProviderProto.UpdateRequest.newBuilder()
                .setId(created.getId())
                .setUrn(TEST_URN)
                .setOlds(created.getProperties())
                .setNews(struct(object("name", of("a"), "tests", ValueTree.secret(list(of("s"))))))
                .build());

        ValueTree outputs = StructCodec.decode(resp.getProperties());
        assertTrue(((ValueTree.ObjectValue) outputs).get("tests").secret());
    }

    @Test
    void update_of_missing_resource_is_invalid_argument() {
        var ex = assertThrows(StatusRuntimeException.class, () -> stub.update(ResourceProviderProto.UpdateRequest.newBuilder()
                .setId("missing")
                .setUrn(TEST_URN)
                .setNews(struct(object("name", of("a"))))
                .build()));

        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
    }

    @Test
    void read_returns_outputs_and_inputs_without_provider_filled_fields() {
        var created = stub.create(ResourceProviderProto.CreateRequest.newBuilder()
                .setUrn(TEST_URN)
                .setProperties(struct(object("name", of("a"), "password", of("p"))))
                .build());

        var resp = stub.read(ResourceProviderProto.ReadRequest.newBuilder()
                .setId(created.getId())
                .setUrn(TEST_URN)
                .build());

        assertEquals(created.getId(), resp.getId());
        assertEquals("res-1-id", resp.getProperties().getFieldsMap().get("id").getStringValue());
        var inputs = (ValueTree.ObjectValue) StructCodec.decode(resp.getInputs());
        assertFalse(inputs.fields().containsKey("id"));
        assertEquals(of("a"), inputs.get("name"));
        assertTrue(inputs.get("password").secret());
    }

    @Test
    void delete_removes_resource_so_read_finds_nothing() {
        var created = stub.create(ResourceProviderProto.CreateRequest.newBuilder()
                .setUrn(TEST_URN)
                .setProperties(struct(object("name", of("a"))))
                .build());

        var deleted = stub.delete(ResourceProviderProto.DeleteRequest.newBuilder()
                .setId(created.getId())
                .setUrn(TEST_URN)
                .setProperties(created.getProperties())
                .build());
        var read = stub.read(ResourceProviderProto.ReadRequest.newBuilder()
                .setId(created.getId())
                .setUrn(TEST_URN)
                .build());

        assertEquals("- prov:index/test:Test res (delete)", deleted.getPreview().strip());
        assertEquals("", read.getId());
        assertFalse(read.hasProperties());
        var ex = assertThrows(StatusRuntimeException.class, () -> stub.update(ResourceProviderProto.UpdateRequest.newBuilder()
                .setId(created.getId())
                .setUrn(TEST_URN)
                .setNews(struct(object("name", of("a"))))
                .build()));
        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
    }

    @Test
    void delete_of_missing_resource_is_invalid_argument() {
        var ex = assertThrows(StatusRuntimeException.class, () -> stub.delete(ResourceProviderProto.DeleteRequest.newBuilder()
                .setId("missing")
                .setUrn(TEST_URN)
                .build()));

        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
        assertEquals("no such resource missing", ex.getStatus().getDescription());
    }
}
