// file: server/src/main/java/io/planbridge/server/provider/GrpcResourceProviderService.java
package io.planbridge.server.provider;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import io.planbridge.core.check.CheckFailure;
import io.planbridge.core.check.CheckResult;
import io.planbridge.core.diff.DiffException;
import io.planbridge.core.diff.DiffOptions;
import io.planbridge.core.diff.ReplaceOverride;
import io.planbridge.core.render.DiffRenderer;
import io.planbridge.core.render.WireKind;
import io.planbridge.core.value.ValueTree;
import io.planbridge.server.BridgeService;
import io.planbridge.server.RequestLogger;
import io.planbridge.server.Urn;
import io.planbridge.server.backend.ResourceBackend;
import io.planbridge.server.codec.StructCodec;

import java.util.function.Supplier;

/**
 * gRPC adapter exposing {@link BridgeService} as the ResourceProvider service
 * (Check, Diff, Create, Update, Read, Delete).
 *
 * Responsibilities:
 *  - Decode Struct payloads into value trees and encode results back.
 *  - Map diff results to the wire shape (kinds, replaces, stables, diffs).
 *  - Map failures to status codes, scoped to the one resource of the call:
 *      DiffException(UNEXPECTED_TYPE), IllegalArgumentException -> INVALID_ARGUMENT
 *      DiffException(STRUCTURAL)                                 -> FAILED_PRECONDITION
 *      anything else                                             -> INTERNAL
 */
public final class GrpcResourceProviderService extends ResourceProviderGrpc.ResourceProviderImplBase {

    private final BridgeService bridge;

    public GrpcResourceProviderService(BridgeService bridge) {
        this.bridge = bridge;
    }

    @Override
    public void check(
            ResourceProviderProto.CheckRequest request,
            StreamObserver<ResourceProviderProto.CheckResponse> responseObserver
    ) {
        respond("Check", request.getUrn(), responseObserver, () -> {
            Urn urn = Urn.parse(request.getUrn());
            CheckResult r = bridge.check(urn, StructCodec.decode(request.getOlds()), StructCodec.decode(request.getNews()));

            var resp = ResourceProviderProto.CheckResponse.newBuilder()
                    .setInputs(StructCodec.encodeStruct(r.inputs()));
            for (CheckFailure f : r.failures()) {
                resp.addFailures(ResourceProviderProto.CheckFailure.newBuilder()
                        .setProperty(f.property())
                        .setReason(f.reason()));
            }
            return resp.build();
        });
    }

    @Override
    public void diff(
            ResourceProviderProto.DiffRequest request,
            StreamObserver<ResourceProviderProto.DiffResponse> responseObserver
    ) {
        respond("Diff", request.getUrn(), responseObserver, () -> {
            Urn urn = Urn.parse(request.getUrn());
            ValueTree olds = request.hasOlds() ? StructCodec.decode(request.getOlds()) : ValueTree.nil();
            var options = new DiffOptions(request.getIgnoreChangesList(), toOverride(request.getReplaceOverride()));

            BridgeService.Planned plan = bridge.diff(urn, olds, StructCodec.decode(request.getNews()), options);

            var resp = ResourceProviderProto.DiffResponse.newBuilder()
                    .setChanges(plan.result().hasChanges()
                            ? ResourceProviderProto.DiffResponse.DiffChanges.DIFF_SOME
                            : ResourceProviderProto.DiffResponse.DiffChanges.DIFF_NONE)
                    .addAllReplaces(plan.result().replacedProperties())
                    .addAllStables(plan.stables())
                    .setDeleteBeforeReplace(plan.deleteBeforeReplace())
                    .addAllDiffs(plan.result().changedProperties())
                    .setHasDetailedDiff(true)
                    .setPreview(plan.preview());
            DiffRenderer.toWire(plan.result()).forEach((path, kind) ->
                    resp.putDetailedDiff(path, ResourceProviderProto.PropertyDiff.newBuilder()
                            .setKind(toProto(kind))
                            .setInputDiff(true)
                            .build()));
            return resp.build();
        });
    }

    @Override
    public void create(
            ResourceProviderProto.CreateRequest request,
            StreamObserver<ResourceProviderProto.CreateResponse> responseObserver
    ) {
        respond("Create", request.getUrn(), responseObserver, () -> {
            Urn urn = Urn.parse(request.getUrn());
            ResourceBackend.Created created = bridge.create(urn, StructCodec.decode(request.getProperties()), request.getPreview());
            return ResourceProviderProto.CreateResponse.newBuilder()
                    .setId(created.id())
                    .setProperties(StructCodec.encodeStruct(created.outputs()))
                    .build();
        });
    }

    @Override
    public void update(
            ResourceProviderProto.UpdateRequest request,
            StreamObserver<ResourceProviderProto.UpdateResponse> responseObserver
    ) {
        respond("Update", request.getUrn(), responseObserver, () -> {
            Urn urn = Urn.parse(request.getUrn());
            ValueTree outputs = bridge.update(
                    request.getId(),
                    urn,
                    StructCodec.decode(request.getOlds()),
                    StructCodec.decode(request.getNews()),
                    request.getPreview());
            return ResourceProviderProto.UpdateResponse.newBuilder()
                    .setProperties(StructCodec.encodeStruct(outputs))
                    .build();
        });
    }

    @Override
    public void read(
            ResourceProviderProto.ReadRequest request,
            StreamObserver<ResourceProviderProto.ReadResponse> responseObserver
    ) {
        respond("Read", request.getUrn(), responseObserver, () -> {
            Urn urn = Urn.parse(request.getUrn());
            BridgeService.Read read = bridge.read(
                    request.getId(),
                    urn,
                    request.hasProperties() ? StructCodec.decode(request.getProperties()) : ValueTree.nil(),
                    request.hasInputs() ? StructCodec.decode(request.getInputs()) : ValueTree.nil());
            var resp = ResourceProviderProto.ReadResponse.newBuilder();
            if (read.id() != null) {
                resp.setId(read.id())
                        .setProperties(StructCodec.encodeStruct(read.outputs()))
                        .setInputs(StructCodec.encodeStruct(read.inputs()));
            }
            return resp.build();
        });
    }

    @Override
    public void delete(
            ResourceProviderProto.DeleteRequest request,
            StreamObserver<ResourceProviderProto.DeleteResponse> responseObserver
    ) {
        respond("Delete", request.getUrn(), responseObserver, () -> {
            Urn urn = Urn.parse(request.getUrn());
            String preview = bridge.delete(request.getId(), urn);
            return ResourceProviderProto.DeleteResponse.newBuilder()
                    .setPreview(preview)
                    .build();
        });
    }

    // ---------- helpers ----------

    private static <T> void respond(String method, String urn, StreamObserver<T> observer, Supplier<T> call) {
        long start = System.nanoTime();
        Status status = Status.OK;
        Throwable error = null;
        try {
            T resp = call.get();
            observer.onNext(resp);
            observer.onCompleted();
        } catch (DiffException de) {
            error = de;
            status = (de.kind() == DiffException.Kind.STRUCTURAL ? Status.FAILED_PRECONDITION : Status.INVALID_ARGUMENT)
                    .withDescription(de.getMessage());
            observer.onError(status.asException());
        } catch (IllegalArgumentException iae) {
            error = iae;
            status = Status.INVALID_ARGUMENT.withDescription(iae.getMessage());
            observer.onError(status.asException());
        } catch (Exception e) {
            error = e;
            status = Status.INTERNAL.withDescription(e.getMessage());
            observer.onError(status.asException());
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRpc(method, urn, status.getCode().name(), totalMs, error);
        }
    }

    static ReplaceOverride toOverride(ResourceProviderProto.ReplaceOverride o) {
        return switch (o) {
            case REPLACE_OVERRIDE_FORCE -> ReplaceOverride.FORCE;
            case REPLACE_OVERRIDE_SUPPRESS -> ReplaceOverride.SUPPRESS;
            default -> ReplaceOverride.NONE;
        };
    }

    static ResourceProviderProto.PropertyDiff.Kind toProto(WireKind kind) {
        return switch (kind) {
            case ADD -> ResourceProviderProto.PropertyDiff.Kind.ADD;
            case ADD_REPLACE -> ResourceProviderProto.PropertyDiff.Kind.ADD_REPLACE;
            case DELETE -> ResourceProviderProto.PropertyDiff.Kind.DELETE;
            case DELETE_REPLACE -> ResourceProviderProto.PropertyDiff.Kind.DELETE_REPLACE;
            case UPDATE -> ResourceProviderProto.PropertyDiff.Kind.UPDATE;
            case UPDATE_REPLACE -> ResourceProviderProto.PropertyDiff.Kind.UPDATE_REPLACE;
        };
    }
}
