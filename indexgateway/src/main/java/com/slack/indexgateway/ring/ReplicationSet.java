package com.slack.indexgateway.ring;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** The instances that hold the replicas of one ring token. */
public class ReplicationSet {
  private final List<InstanceDesc> instances;

  public ReplicationSet(List<InstanceDesc> instances) {
    this.instances = ImmutableList.copyOf(instances);
  }

  public List<InstanceDesc> getInstances() {
    return instances;
  }

  /** Returns a new, mutable list of the instance addresses in ring order. */
  public List<String> getAddresses() {
    List<String> addresses = new ArrayList<>(instances.size());
    for (InstanceDesc instance : instances) {
      addresses.add(instance.address);
    }
    return addresses;
  }
}
