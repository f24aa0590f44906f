package com.modtools.idconflict.model;

import java.util.Comparator;

import lombok.Value;

/**
 * Identifies one resource inside a package: type and group are unsigned 32-bit,
 * instance is unsigned 64-bit. Java signed primitives carry the raw bits.
 */
@Value
public class ResourceKey implements Comparable<ResourceKey> {

    private static final Comparator<ResourceKey> ORDER = Comparator
            .comparing((ResourceKey k) -> k.typeId, Integer::compareUnsigned)
            .thenComparing(k -> k.groupId, Integer::compareUnsigned)
            .thenComparing(k -> k.instanceId, Long::compareUnsigned);

    int typeId;
    int groupId;
    long instanceId;

    public static ResourceKey of(int typeId, int groupId, long instanceId) {
        return new ResourceKey(typeId, groupId, instanceId);
    }

    /**
     * Builds a key from the four little-endian words of an index row.
     */
    public static ResourceKey fromWords(int typeId, int groupId, int instanceHigh, int instanceLow) {
        long instance = (Integer.toUnsignedLong(instanceHigh) << 32) | Integer.toUnsignedLong(instanceLow);
        return new ResourceKey(typeId, groupId, instance);
    }

    /**
     * All-zero keys mark padding or empty slots, never a real resource.
     */
    public boolean isEmpty() {
        return typeId == 0 && groupId == 0 && instanceId == 0L;
    }

    public long typeIdUnsigned() {
        return Integer.toUnsignedLong(typeId);
    }

    public long groupIdUnsigned() {
        return Integer.toUnsignedLong(groupId);
    }

    public String typeHex() {
        return String.format("0x%08X", typeId);
    }

    public String groupHex() {
        return String.format("0x%08X", groupId);
    }

    public String instanceHex() {
        return String.format("0x%016X", instanceId);
    }

    /** {@code T:G:I} in hex, as shown in reports. */
    public String toHexString() {
        return typeHex() + ":" + groupHex() + ":" + instanceHex();
    }

    @Override
    public int compareTo(ResourceKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return toHexString();
    }
}
