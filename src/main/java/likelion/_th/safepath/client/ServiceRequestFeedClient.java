package likelion._th.safepath.client;

import com.fasterxml.jackson.databind.JsonNode;
import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.Incident;
import likelion._th.safepath.domain.IncidentCategory;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.util.IncidentClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * SF 311 service requests (DataSF vw6y-z8j6): encampment, aggressive and
 * threatening behaviour reports.
 */
@Component
@Slf4j
public class ServiceRequestFeedClient extends DataSfFeedClient {

    public static final String SOURCE_ID = "311-feed";
    static final String DATASET = "vw6y-z8j6";

    // 같은 야영지로 보는 위경도 차이
    static final double ENCAMPMENT_CLUSTER_DEGREES = 0.001;

    public ServiceRequestFeedClient(@Qualifier("datasfClient") WebClient webClient,
                                    SafePathProperties properties,
                                    Clock clock) {
        super(webClient, properties, clock);
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public List<Incident> fetch() {
        String where = "(service_name like '%Aggressive%' OR service_name like '%Threatening%'"
                + " OR service_name like '%Encampment%') AND requested_datetime >= '" + lookbackDate() + "'";

        JsonNode records = query(DATASET, where, "requested_datetime DESC",
                properties.getFetch().getServiceRequestLimit());

        List<Incident> incidents = new ArrayList<>();
        List<Incident> encampments = new ArrayList<>();
        int dropped = 0;

        for (JsonNode record : records) {
            Optional<Incident> mapped = toIncident(record);
            if (mapped.isEmpty()) {
                dropped++;
                continue;
            }
            Incident incident = mapped.get();
            if (incident.getCategory() == IncidentCategory.ENCAMPMENT) {
                // 종료된 야영지 신고 제외
                if ("closed".equalsIgnoreCase(incident.getStatus())) {
                    dropped++;
                    continue;
                }
                encampments.add(incident);
            } else {
                incidents.add(incident);
            }
        }

        List<Incident> merged = mergeEncampments(encampments);
        incidents.addAll(merged);

        log.info("311 신고 {} 건 수신 → {} 건 변환 (제외: {}, 야영지 {} → {})",
                records.size(), incidents.size(), dropped, encampments.size(), merged.size());
        return incidents;
    }

    private Optional<Incident> toIncident(JsonNode record) {
        String id = text(record, "service_request_id");
        Optional<LatLng> location = toLatLng(text(record, "lat"), text(record, "long"))
                .or(() -> parsePoint(record.get("point_geom")))
                .or(() -> parsePoint(record.get("point")));
        Optional<Instant> occurredAt = parseTimestamp(text(record, "requested_datetime"));

        if (id == null || location.isEmpty() || occurredAt.isEmpty()) {
            return Optional.empty();
        }

        String serviceName = Optional.ofNullable(text(record, "service_name")).orElse("");
        String subtype = Optional.ofNullable(text(record, "service_subtype")).orElse("");
        IncidentClassifier.Classification classification =
                IncidentClassifier.classify(serviceName + " " + subtype, null);

        return Optional.of(Incident.builder()
                .id(id)
                .sourceId(SOURCE_ID)
                .category(classification.getCategory())
                .severity(classification.getSeverity())
                .location(location.get())
                .occurredAt(occurredAt.get())
                .description(subtype.isBlank() ? serviceName : serviceName + ": " + subtype)
                .status(text(record, "status_description"))
                .build());
    }

    /**
     * Collapses encampment reports lying within {@value #ENCAMPMENT_CLUSTER_DEGREES}
     * degrees (both axes) of a newer report into that newer report. The newest
     * report's id survives, so ids stay stable across refetches.
     */
    static List<Incident> mergeEncampments(List<Incident> encampments) {
        List<Incident> newestFirst = new ArrayList<>(encampments);
        newestFirst.sort(Comparator.comparing(Incident::getOccurredAt).reversed()
                .thenComparing(Incident::getId));

        List<Incident> representatives = new ArrayList<>();
        List<Integer> clusterSizes = new ArrayList<>();

        for (Incident report : newestFirst) {
            int cluster = -1;
            for (int i = 0; i < representatives.size(); i++) {
                if (isSameSite(representatives.get(i).getLocation(), report.getLocation())) {
                    cluster = i;
                    break;
                }
            }
            if (cluster < 0) {
                representatives.add(report);
                clusterSizes.add(1);
            } else {
                clusterSizes.set(cluster, clusterSizes.get(cluster) + 1);
            }
        }

        List<Incident> merged = new ArrayList<>(representatives.size());
        for (int i = 0; i < representatives.size(); i++) {
            Incident rep = representatives.get(i);
            int size = clusterSizes.get(i);
            merged.add(size == 1 ? rep : rep.toBuilder()
                    .description(rep.getDescription() + " (" + size + " reports at this location)")
                    .build());
        }
        return merged;
    }

    private static boolean isSameSite(LatLng a, LatLng b) {
        return Math.abs(a.getLat() - b.getLat()) <= ENCAMPMENT_CLUSTER_DEGREES
                && Math.abs(a.getLng() - b.getLng()) <= ENCAMPMENT_CLUSTER_DEGREES;
    }
}
