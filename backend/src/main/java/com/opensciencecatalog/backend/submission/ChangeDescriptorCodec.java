package com.opensciencecatalog.backend.submission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Objects;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Writes and reads the JSON payload stored as a pull request body. Only the fields describing the
 * change itself are embedded; status, url and creation time are taken from the pull request.
 */
@Component
public class ChangeDescriptorCodec {

  static final String FIELD_FILENAME = "filename";
  static final String FIELD_ITEM_TYPE = "item_type";
  static final String FIELD_CHANGE_TYPE = "change_type";
  static final String FIELD_USER = "user";
  static final String FIELD_DATA_OWNER = "data_owner";

  private final ObjectMapper objectMapper;

  public ChangeDescriptorCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public String encode(ChangeDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    ObjectNode node = objectMapper.createObjectNode();
    node.put(FIELD_FILENAME, descriptor.filename());
    node.put(FIELD_ITEM_TYPE, descriptor.itemType());
    node.put(FIELD_CHANGE_TYPE, descriptor.changeKind().wireValue());
    node.put(FIELD_USER, descriptor.user());
    node.put(FIELD_DATA_OWNER, descriptor.dataOwner());
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize change descriptor", ex);
    }
  }

  /**
   * Rebuilds a descriptor from a pull request body. Unknown keys are ignored.
   *
   * @throws DescriptorDecodeException when the body is not a descriptor; never anything else
   */
  public ChangeDescriptor decode(
      String body, SubmissionStatus status, String url, Instant createdAt) {
    if (!StringUtils.hasText(body)) {
      throw new DescriptorDecodeException("Pull request body is empty");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new DescriptorDecodeException("Pull request body is not valid JSON", ex);
    }
    if (root == null || !root.isObject()) {
      throw new DescriptorDecodeException("Pull request body must be a JSON object");
    }
    String filename = requireText(root, FIELD_FILENAME);
    String itemType = requireText(root, FIELD_ITEM_TYPE);
    ChangeKind changeKind = requireChangeKind(root);
    String user = requireText(root, FIELD_USER);
    JsonNode dataOwner = root.get(FIELD_DATA_OWNER);
    if (dataOwner == null || !dataOwner.isBoolean()) {
      throw new DescriptorDecodeException("Field '" + FIELD_DATA_OWNER + "' must be a boolean");
    }
    return new ChangeDescriptor(
        filename, itemType, changeKind, status, url, createdAt, user, dataOwner.booleanValue());
  }

  private static String requireText(JsonNode root, String field) {
    JsonNode value = root.get(field);
    if (value == null || !value.isTextual()) {
      throw new DescriptorDecodeException("Field '" + field + "' must be a string");
    }
    return value.textValue();
  }

  private static ChangeKind requireChangeKind(JsonNode root) {
    String value = requireText(root, FIELD_CHANGE_TYPE);
    try {
      return ChangeKind.fromWireValue(value);
    } catch (IllegalArgumentException ex) {
      throw new DescriptorDecodeException("Unsupported change type '" + value + "'", ex);
    }
  }
}
