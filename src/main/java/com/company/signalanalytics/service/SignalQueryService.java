package com.company.signalanalytics.service;

import com.company.signalanalytics.domain.DimensionEntity;
import com.company.signalanalytics.domain.EntitySelection;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.query.EntityFilterResolver;
import com.company.signalanalytics.query.ResolvedEntities;
import com.company.signalanalytics.repository.DimensionRepository;
import com.company.signalanalytics.repository.GeometryRepository;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SignalQueryService {

    private final EntityFilterResolver entityFilterResolver;
    private final DimensionRepository dimensionRepository;
    private final GeometryRepository geometryRepository;

    /**
     * Every located signal/segment pair.
     */
    public Table listSignals() {
        return dimensionRepository.findDimensionRows(ResolvedEntities.unrestricted());
    }

    /**
     * Signal table rows for the hierarchical district/signal pickers.
     */
    public Table listDimSignals() {
        return dimensionRepository.findSignals();
    }

    /**
     * Located signal/segment pairs of a selection, with each signal's
     * maintainer.
     */
    public List<DimensionEntity> findSegments(EntitySelection selection) {
        ResolvedEntities entities = entityFilterResolver.resolve(selection);
        List<DimensionEntity> segments = dimensionRepository.findEntities(entities);
        log.debug("{} selection resolved to {} signal/segment pairs", entities.getStrategy(), segments.size());
        return segments;
    }

    public ObjectNode getXdGeometry() {
        return geometryRepository.getFeatureCollection();
    }

    public void refreshXdGeometry() {
        geometryRepository.invalidate();
    }
}
