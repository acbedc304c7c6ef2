package com.wildsentinel.core.context;

import java.io.Serializable;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Static facts about one camera trap.
 *
 * @since 1.0.0
 */
public final class CameraMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String cameraId;
    private final String name;
    private final int frameWidth;
    private final int frameHeight;
    /** Zone used to derive the local hour of a detection. */
    private final ZoneId zoneId;

    public CameraMetadata(String cameraId, String name, int frameWidth, int frameHeight, ZoneId zoneId) {
        this.cameraId = Objects.requireNonNull(cameraId, "cameraId must not be null");
        this.name = name != null ? name : cameraId;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.zoneId = zoneId != null ? zoneId : ZoneOffset.UTC;
    }

    public String getCameraId() {
        return cameraId;
    }

    public String getName() {
        return name;
    }

    public int getFrameWidth() {
        return frameWidth;
    }

    public int getFrameHeight() {
        return frameHeight;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    @Override
    public String toString() {
        return "CameraMetadata{" +
                "cameraId='" + cameraId + '\'' +
                ", name='" + name + '\'' +
                ", frame=" + frameWidth + "x" + frameHeight +
                ", zoneId=" + zoneId +
                '}';
    }
}
