package likelion._th.safepath.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

// WGS84 좌표 (degrees)
@Getter
@EqualsAndHashCode
@ToString
public class LatLng {
    private final double lat;
    private final double lng;

    @JsonCreator
    public LatLng(@JsonProperty("lat") double lat, @JsonProperty("lng") double lng) {
        this.lat = lat;
        this.lng = lng;
    }
}
