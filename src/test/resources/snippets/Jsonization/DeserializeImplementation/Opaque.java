/**
 * Parse an instance of {@link Opaque}.
 */
static Reporting.Result<Opaque> opaqueFrom(JsonNode node) {
    if (!node.isObject()) {
        return Reporting.Result.failure(new Reporting.Error(
                "Expected a JSON object, but got " + node.getNodeType()));
    }
    JsonNode payload = node.get("payload");
    if (payload == null || !payload.isTextual()) {
        return Reporting.Result.failure(new Reporting.Error(
                "Expected a textual payload"));
    }
    return Reporting.Result.success(new Opaque(payload.textValue()));
}
