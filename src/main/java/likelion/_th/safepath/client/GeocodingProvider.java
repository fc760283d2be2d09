package likelion._th.safepath.client;

import likelion._th.safepath.domain.LatLng;

import java.util.Optional;

public interface GeocodingProvider {

    /** First match for the address, empty when nothing resolves or the provider fails */
    Optional<LatLng> geocode(String address);
}
