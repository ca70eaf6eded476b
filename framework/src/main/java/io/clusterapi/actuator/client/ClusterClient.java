// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package io.clusterapi.actuator.client;

import java.util.List;

import io.clusterapi.actuator.watcher.NotificationSource;
import io.clusterapi.actuator.watcher.Subscription;
import io.clusterapi.actuator.watcher.SubscriptionException;
import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiException;

import static java.net.HttpURLConnection.HTTP_NOT_FOUND;

/**
 * The operations the suite needs from the cluster. For cluster-scoped kinds the namespace arguments are ignored.
 */
public interface ClusterClient extends NotificationSource {

  String PROPAGATION_FOREGROUND = "Foreground";
  String PROPAGATION_BACKGROUND = "Background";

  <T extends KubernetesObject, L extends KubernetesListObject> List<T> list(
      ResourceKind<T, L> kind, String namespace, String labelSelector) throws ApiException;

  default <T extends KubernetesObject, L extends KubernetesListObject> List<T> list(
      ResourceKind<T, L> kind, String namespace) throws ApiException {
    return list(kind, namespace, null);
  }

  /**
   * Reads a single resource.
   *
   * @param kind the kind of resource
   * @param namespace the namespace
   * @param name the name
   * @param <T> the resource type
   * @param <L> the list type
   * @return the resource
   * @throws ApiException if the read fails, with code 404 if there is no such resource
   */
  <T extends KubernetesObject, L extends KubernetesListObject> T get(
      ResourceKind<T, L> kind, String namespace, String name) throws ApiException;

  <T extends KubernetesObject, L extends KubernetesListObject> T create(
      ResourceKind<T, L> kind, T object) throws ApiException;

  <T extends KubernetesObject, L extends KubernetesListObject> T update(
      ResourceKind<T, L> kind, T object) throws ApiException;

  <T extends KubernetesObject, L extends KubernetesListObject> void delete(
      ResourceKind<T, L> kind, T object, String propagationPolicy) throws ApiException;

  /**
   * Opens a subscription to the cluster's events. Only events recorded after the call are delivered.
   *
   * @return the subscription
   * @throws SubscriptionException if the event stream cannot be opened
   */
  Subscription openNotificationSubscription() throws SubscriptionException;

  @Override
  default Subscription openSubscription() throws SubscriptionException {
    return openNotificationSubscription();
  }

  static boolean isNotFound(ApiException e) {
    return e.getCode() == HTTP_NOT_FOUND;
  }
}
