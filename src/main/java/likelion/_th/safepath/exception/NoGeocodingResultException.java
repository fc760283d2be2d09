package likelion._th.safepath.exception;

import lombok.Getter;

@Getter
public class NoGeocodingResultException extends RuntimeException {

    private final String address;

    public NoGeocodingResultException(String address) {
        super("주소를 좌표로 변환할 수 없음: " + address);
        this.address = address;
    }
}
