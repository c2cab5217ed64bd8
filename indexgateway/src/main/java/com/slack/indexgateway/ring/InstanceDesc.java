package com.slack.indexgateway.ring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Objects;

/** A gateway instance registered in the ring. */
public class InstanceDesc {
  public final String id;
  public final String address;
  public final String zone;

  public InstanceDesc(String id, String address, String zone) {
    checkArgument(!Strings.isNullOrEmpty(id), "id can't be null or empty");
    checkArgument(!Strings.isNullOrEmpty(address), "address can't be null or empty");
    this.id = id;
    this.address = address;
    this.zone = Strings.nullToEmpty(zone);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof InstanceDesc)) return false;
    InstanceDesc that = (InstanceDesc) o;
    return id.equals(that.id) && address.equals(that.address) && zone.equals(that.zone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, address, zone);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("address", address)
        .add("zone", zone)
        .toString();
  }
}
