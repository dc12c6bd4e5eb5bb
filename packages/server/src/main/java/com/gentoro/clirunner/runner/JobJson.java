package com.gentoro.clirunner.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.clirunner.utility.JacksonUtility;

/**
 * JSON shapes shared by the event stream and the REST endpoints. Payloads that are valid JSON are
 * embedded as JSON, anything else as a string.
 */
public final class JobJson {
  private JobJson() {}

  public static JsonNode payloadNode(String payload) {
    JsonNode parsed = JacksonUtility.tryParse(payload);
    return parsed != null ? parsed : TextNode.valueOf(payload == null ? "" : payload);
  }

  public static ObjectNode resultNode(JobResult result) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("exitCode", result.exitCode());
    if (result.output() != null) node.set("output", payloadNode(result.output()));
    if (result.errorMessage() != null) node.put("error", result.errorMessage());
    return node;
  }

  public static ObjectNode snapshotNode(JobSnapshot s) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("id", s.id());
    node.put("connector", s.connector());
    node.put("prompt", s.prompt());
    if (s.workDir() != null) node.put("workDir", s.workDir());
    node.put("status", s.status().wireName());
    node.put("startedAt", s.startedAt().toString());
    if (s.completedAt() != null) node.put("completedAt", s.completedAt().toString());
    if (s.result() != null) node.set("result", resultNode(s.result()));
    return node;
  }

  public static ObjectNode eventNode(JobEvent event) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("kind", event.kind().wireName());
    node.set("payload", payloadNode(event.payload()));
    node.put("timestamp", event.timestamp().toString());
    return node;
  }

  static String errorPayload(String message) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("error", message);
    return JacksonUtility.toJson(node);
  }

  static String donePayload(String jobId, JobStatus status, JobResult result) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("processId", jobId);
    node.put("status", status.wireName());
    if (result != null) {
      node.set("result", resultNode(result));
    } else {
      node.putNull("result");
    }
    return JacksonUtility.toJson(node);
  }
}
