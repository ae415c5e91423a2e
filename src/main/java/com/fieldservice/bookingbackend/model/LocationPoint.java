package com.fieldservice.bookingbackend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.geo.GeoJsonPoint;
import org.springframework.data.mongodb.core.index.GeoSpatialIndexType;
import org.springframework.data.mongodb.core.index.GeoSpatialIndexed;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * A single GPS fix reported by a professional's device.
 */
@Data
@NoArgsConstructor
public class LocationPoint implements Serializable {
    private static final long serialVersionUID = 1L;

    private double latitude;
    private double longitude;
    private double accuracy;
    private double speed;
    private double heading;
    private LocalDateTime timestamp;

    // GeoJSON copy of latitude/longitude, [lon, lat] order, backs the proximity index
    @JsonIgnore
    @GeoSpatialIndexed(type = GeoSpatialIndexType.GEO_2DSPHERE)
    private GeoJsonPoint point;

    public static LocationPoint of(double latitude, double longitude,
                                   Double accuracy, Double speed, Double heading,
                                   LocalDateTime timestamp) {
        LocationPoint p = new LocationPoint();
        p.setLatitude(latitude);
        p.setLongitude(longitude);
        p.setAccuracy(accuracy != null ? accuracy : 0.0);
        p.setSpeed(speed != null ? speed : 0.0);
        p.setHeading(heading != null ? heading : 0.0);
        p.setTimestamp(timestamp);
        p.setPoint(new GeoJsonPoint(longitude, latitude));
        return p;
    }
}
