// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.actions;

import java.util.Optional;

import io.clusterapi.actuator.waiter.FatalConfigurationException;
import io.kubernetes.client.openapi.models.V1Node;
import io.kubernetes.client.openapi.models.V1ObjectMeta;

import static io.clusterapi.actuator.ActuatorConstants.MACHINE_ANNOTATION_KEY;

/**
 * The namespace and name of the machine backing a node, as recorded in the node's machine annotation.
 *
 * @param namespace the machine namespace
 * @param name the machine name
 */
public record MachineKey(String namespace, String name) {

  /**
   * Parses an annotation value of the form {@code namespace/name}.
   *
   * @param value the annotation value
   * @return the key
   * @throws FatalConfigurationException if the value is not of the expected form
   */
  public static MachineKey parse(String value) {
    String[] parts = value.split("/", -1);
    if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
      throw new FatalConfigurationException(
          "Machine annotation '" + value + "' is not of the form <namespace>/<name>");
    }
    return new MachineKey(parts[0], parts[1]);
  }

  /**
   * Returns the machine key recorded on a node, if any.
   *
   * @param node the node
   * @return the key, or empty if the node has no machine annotation
   * @throws FatalConfigurationException if the annotation is present but malformed
   */
  public static Optional<MachineKey> of(V1Node node) {
    return Optional.ofNullable(node.getMetadata())
        .map(V1ObjectMeta::getAnnotations)
        .map(annotations -> annotations.get(MACHINE_ANNOTATION_KEY))
        .map(MachineKey::parse);
  }

  @Override
  public String toString() {
    return namespace + "/" + name;
  }
}
