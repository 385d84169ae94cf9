package com.company.signalanalytics.service;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.DateRange;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.LegendSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.AnomalyType;
import com.company.signalanalytics.domain.enums.ColumnType;
import com.company.signalanalytics.domain.enums.LegendField;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.query.EntityFilterResolver;
import com.company.signalanalytics.query.FragmentKind;
import com.company.signalanalytics.query.LegendCap;
import com.company.signalanalytics.query.LegendCapper;
import com.company.signalanalytics.query.PredicateComposer;
import com.company.signalanalytics.query.PredicateSet;
import com.company.signalanalytics.query.RollupSelector;
import com.company.signalanalytics.repository.DimensionRepository;
import com.company.signalanalytics.repository.TravelTimeAggregateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyQueryServiceTest {

    private static final DateRange MONTH = DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

    @Mock
    private DimensionRepository dimensionRepository;

    @Mock
    private TravelTimeAggregateRepository aggregateRepository;

    @Mock
    private LegendCapper legendCapper;

    private AnomalyQueryService service;

    @BeforeEach
    void setUp() {
        EntityFilterResolver resolver = new EntityFilterResolver();
        service = new AnomalyQueryService(resolver, new RollupSelector(), new PredicateComposer(resolver),
                legendCapper, dimensionRepository, aggregateRepository, new ResultAssembler(),
                new SignalAnalyticsProperties());
    }

    @Test
    void shouldZeroCountsForSegmentsWithoutAnomalies() {
        Map<String, Object> located = new LinkedHashMap<>();
        located.put("ID", "S1");
        located.put("XD", 5L);
        Map<String, Object> quiet = new LinkedHashMap<>();
        quiet.put("ID", "S1");
        quiet.put("XD", 6L);
        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("XD", 5L);
        counts.put("ANOMALY_COUNT", 3L);
        counts.put("POINT_SOURCE_COUNT", 1L);

        when(dimensionRepository.findDimensionRows(any())).thenReturn(new Table(List.of(
                ColumnSpec.nonNull("ID", ColumnType.STRING),
                ColumnSpec.nonNull("XD", ColumnType.INTEGER)), List.of(located, quiet)));
        when(aggregateRepository.anomalyCountsByXd(any(), eq(AnomalyType.POINT_SOURCE)))
                .thenReturn(new Table(List.of(), List.of(counts)));

        Table summary = service.getAnomalySummary(FilterSpec.builder().dateRange(MONTH).removeAnomalies(true).build(),
                AnomalyType.POINT_SOURCE);

        assertEquals(2, summary.rowCount());
        assertEquals(3L, summary.getRows().get(0).get("ANOMALY_COUNT"));
        assertEquals(0L, summary.getRows().get(1).get("POINT_SOURCE_COUNT"));

        ArgumentCaptor<PredicateSet> predicates = ArgumentCaptor.forClass(PredicateSet.class);
        verify(aggregateRepository).anomalyCountsByXd(predicates.capture(), eq(AnomalyType.POINT_SOURCE));
        assertEquals(RollupTier.DAILY, predicates.getValue().getTier());
        assertFalse(predicates.getValue().has(FragmentKind.ANOMALY_EXCLUSION));
    }

    @Test
    void shouldCapSeriesLegendToAnomalyLimit() {
        LegendCap cap = new LegendCap(LegendField.XD, List.of(5L, 6L));
        when(legendCapper.cap(eq(new LegendSpec(LegendField.XD, 6)), any(), eq(RollupTier.DAILY))).thenReturn(cap);
        when(aggregateRepository.anomalySeries(any(), eq(cap))).thenReturn(Table.empty(List.of()));

        service.getAnomalySeries(FilterSpec.builder().dateRange(MONTH).build(), LegendField.XD);

        ArgumentCaptor<PredicateSet> predicates = ArgumentCaptor.forClass(PredicateSet.class);
        verify(aggregateRepository).anomalySeries(predicates.capture(), eq(cap));
        assertEquals(List.of(FragmentKind.DATE_RANGE, FragmentKind.LEGEND), predicates.getValue().kinds());
    }

    @Test
    void shouldReturnDetailSchemaWithoutFactQueryWhenNothingIsLocated() {
        when(dimensionRepository.findDimensionRows(any())).thenReturn(Table.empty(List.of()));

        Table detail = service.getTravelTimeDetail(FilterSpec.builder().dateRange(MONTH).build());

        assertTrue(detail.isEmpty());
        assertEquals(List.of("XD", "TIMESTAMP", "TRAVEL_TIME_SECONDS", "PREDICTION", "ANOMALY",
                "ORIGINATED_ANOMALY", "ID", "LATITUDE", "LONGITUDE", "APPROACH", "VALID_GEOMETRY"),
                detail.columnNames());
        verifyNoInteractions(aggregateRepository);
    }

    @Test
    void shouldReadDetailFromRawTierRegardlessOfWindow() {
        Map<String, Object> dimension = new LinkedHashMap<>();
        dimension.put("ID", "S1");
        dimension.put("XD", 5L);
        dimension.put("LATITUDE", 44.05);
        dimension.put("LONGITUDE", -123.09);
        dimension.put("APPROACH", Boolean.TRUE);
        dimension.put("VALID_GEOMETRY", Boolean.TRUE);
        Map<String, Object> fact = new LinkedHashMap<>();
        fact.put("XD", 5L);
        fact.put("TIMESTAMP", LocalDateTime.of(2024, 1, 3, 8, 15));
        fact.put("TRAVEL_TIME_SECONDS", 61.0);
        fact.put("PREDICTION", 55.0);
        fact.put("ANOMALY", Boolean.TRUE);
        fact.put("ORIGINATED_ANOMALY", Boolean.FALSE);

        when(dimensionRepository.findDimensionRows(any())).thenReturn(new Table(List.of(), List.of(dimension)));
        when(aggregateRepository.rawRows(any())).thenReturn(new Table(List.of(), List.of(fact)));

        Table detail = service.getTravelTimeDetail(
                FilterSpec.builder().dateRange(MONTH).removeAnomalies(true).build());

        ArgumentCaptor<PredicateSet> predicates = ArgumentCaptor.forClass(PredicateSet.class);
        verify(aggregateRepository).rawRows(predicates.capture());
        assertEquals(RollupTier.RAW, predicates.getValue().getTier());
        assertFalse(predicates.getValue().has(FragmentKind.ANOMALY_EXCLUSION));

        assertEquals(1, detail.rowCount());
        assertEquals("S1", detail.getRows().get(0).get("ID"));
        assertEquals(44.05, detail.getRows().get(0).get("LATITUDE"));
        assertEquals(Boolean.TRUE, detail.getRows().get(0).get("ANOMALY"));
    }
}
