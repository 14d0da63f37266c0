package com.questrail.hexrot.mock.simple;

/**
 * Configuration reported by the simple device.
 *
 * @param minPosition minimum commandable position
 * @param maxPosition maximum commandable position
 * @param maxVelocity slew rate in position units per second
 */
public record SimpleConfig(double minPosition, double maxPosition, double maxVelocity)
{
    public static final SimpleConfig DEFAULT = new SimpleConfig(-25, 25, 47);

    public SimpleConfig withMaxVelocity(double maxVelocity) {
        return new SimpleConfig(minPosition, maxPosition, maxVelocity);
    }

    public boolean inRange(double position) {
        return position >= minPosition && position <= maxPosition;
    }
}
