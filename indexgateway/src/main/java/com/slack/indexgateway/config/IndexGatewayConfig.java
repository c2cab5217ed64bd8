package com.slack.indexgateway.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import com.slack.indexgateway.proto.config.IndexGatewayConfigs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/**
 * Loads the index gateway client config from YAML or JSON. YAML values may reference environment
 * variables as {@code ${NAME}} or {@code ${NAME:-default}}.
 */
public class IndexGatewayConfig {

  private IndexGatewayConfig() {}

  // Parse a json string as a IndexGatewayClientConfig proto struct.
  public static IndexGatewayConfigs.IndexGatewayClientConfig fromJsonConfig(String jsonStr)
      throws InvalidProtocolBufferException {
    IndexGatewayConfigs.IndexGatewayClientConfig.Builder builder =
        IndexGatewayConfigs.IndexGatewayClientConfig.newBuilder();
    JsonFormat.parser().ignoringUnknownFields().merge(jsonStr, builder);
    IndexGatewayConfigs.IndexGatewayClientConfig config = builder.build();
    ValidateIndexGatewayConfig.validateConfig(config);
    return config;
  }

  // Parse a yaml string as a IndexGatewayClientConfig proto struct
  public static IndexGatewayConfigs.IndexGatewayClientConfig fromYamlConfig(String yamlStr)
      throws InvalidProtocolBufferException, JsonProcessingException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  public static IndexGatewayConfigs.IndexGatewayClientConfig fromYamlConfig(
      String yamlStr, StringLookup variableResolver)
      throws InvalidProtocolBufferException, JsonProcessingException {
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  public static IndexGatewayConfigs.IndexGatewayClientConfig fromFile(Path cfgFilePath)
      throws IOException {
    if (Files.notExists(cfgFilePath)) {
      throw new IllegalArgumentException(
          "Missing config file at: " + cfgFilePath.toAbsolutePath());
    }

    String filename = cfgFilePath.getFileName().toString();
    if (filename.endsWith(".yaml") || filename.endsWith(".yml")) {
      return fromYamlConfig(Files.readString(cfgFilePath));
    } else if (filename.endsWith(".json")) {
      return fromJsonConfig(Files.readString(cfgFilePath));
    }
    throw new IllegalArgumentException(
        "Invalid config file format provided - must be either .json or .yaml");
  }
}
