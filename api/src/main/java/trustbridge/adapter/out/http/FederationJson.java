package trustbridge.adapter.out.http;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import trustbridge.core.model.authz.FederatedResource;
import trustbridge.core.model.authz.FederatedSubject;
import trustbridge.core.model.authz.PolicyDecision;
import trustbridge.core.model.authz.PolicyInput;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.MalformedPeerResponseException;

/**
 * Wire shapes exchanged with policy engines and peers.
 */
final class FederationJson {

    private FederationJson() {}

    /**
     * Policy engine input document, wrapped in {@code {"input": ...}}.
     */
    static JsonObject policyEngineInput(PolicyInput input) {
        final var subject = subject(input.subject()).put("authenticated", true);
        final var resource = new JsonObject()
                .put("resourceId", input.resource().resourceId())
                .put("classification", input.resource().classification())
                .put("releasabilityTo", new JsonArray(input.resource().releasabilityTo()))
                .put("COI", new JsonArray(new ArrayList<>(input.resource().communitiesOfInterest())));
        final var context = new JsonObject()
                .put("currentTime", input.currentTime().toString())
                .put("requestId", input.requestId())
                .put("federatedAccess", true)
                .put("originInstance", input.originInstance())
                .put("targetInstance", input.targetInstance());
        return new JsonObject().put("input", new JsonObject()
                .put("subject", subject)
                .put("action", new JsonObject().put("operation", input.action().wireName()))
                .put("resource", resource)
                .put("context", context));
    }

    /**
     * Body of a peer's policy evaluation request.
     */
    static JsonObject remoteEvaluation(PolicyInput input, String federatedFrom) {
        return new JsonObject()
                .put("subject", subject(input.subject()).put("federatedFrom", federatedFrom))
                .put("resource", resource(input.resource()))
                .put("action", input.action().wireName())
                .put("requestId", input.requestId());
    }

    static JsonObject subject(FederatedSubject subject) {
        final var json = new JsonObject()
                .put("uniqueID", subject.uniqueId())
                .put("clearance", subject.clearance())
                .put("countryOfAffiliation", subject.countryOfAffiliation())
                .put("acpCOI", new JsonArray(new ArrayList<>(subject.communitiesOfInterest())))
                .put("originInstance", subject.originInstance());
        subject.organizationType().ifPresent(type -> json.put("organizationType", type));
        subject.dutyOrg().ifPresent(org -> json.put("dutyOrg", org));
        return json;
    }

    static JsonObject resource(FederatedResource resource) {
        final var json = new JsonObject()
                .put("resourceId", resource.resourceId())
                .put("classification", resource.classification())
                .put("releasabilityTo", new JsonArray(resource.releasabilityTo()))
                .put("COI", new JsonArray(new ArrayList<>(resource.communitiesOfInterest())))
                .put("instanceId", resource.instanceId());
        resource.title().ifPresent(title -> json.put("title", title));
        resource.instanceUrl().ifPresent(url -> json.put("instanceUrl", url));
        return json;
    }

    /**
     * Read {@code {"allow": bool, "reason": string}}.
     *
     * @throws MalformedPeerResponseException when {@code allow} is missing or not a boolean
     */
    static PolicyDecision decision(JsonObject json) {
        if (json == null || !(json.getValue("allow") instanceof Boolean allow)) {
            throw new MalformedPeerResponseException("Decision has no boolean 'allow' member");
        }
        final var reason = json.getValue("reason") instanceof String text && !text.isBlank()
                ? text
                : (allow ? "Access allowed" : "Access denied");
        return new PolicyDecision(allow, reason);
    }

    /**
     * Read one resource of a peer's query response, attributing it to {@code owner}.
     */
    static FederatedResource resource(JsonObject json, InstanceConfig owner) {
        if (!(json.getValue("resourceId") instanceof String id) || id.isBlank()) {
            throw new MalformedPeerResponseException("Resource has no 'resourceId'");
        }
        return new FederatedResource(
                id,
                Optional.ofNullable(json.getString("title")),
                json.getString("classification", "UNCLASSIFIED"),
                strings(json.getValue("releasabilityTo")),
                new LinkedHashSet<>(strings(json.getValue("COI"))),
                owner.instanceId(),
                Optional.of(owner.baseUrl().toString()));
    }

    static List<String> strings(Object value) {
        if (value instanceof JsonArray array) {
            final var result = new ArrayList<String>(array.size());
            for (int i = 0; i < array.size(); i++) {
                final var item = array.getValue(i);
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        if (value instanceof String single) {
            return List.of(single);
        }
        return List.of();
    }

    /**
     * Plain Java view of a JSON object; arrays become lists and nested objects maps.
     */
    static Map<String, Object> toMap(JsonObject json) {
        final var result = new LinkedHashMap<String, Object>();
        for (var entry : json) {
            result.put(entry.getKey(), plain(entry.getValue()));
        }
        return result;
    }

    private static Object plain(Object value) {
        if (value instanceof JsonObject object) {
            return toMap(object);
        }
        if (value instanceof JsonArray array) {
            final var list = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(plain(array.getValue(i)));
            }
            return list;
        }
        return value;
    }
}
