package com.demo.underwriting.service.features;

import com.demo.underwriting.model.FeatureGroup;
import com.demo.underwriting.model.FeatureName;
import com.demo.underwriting.model.FeatureValue;

import java.util.Map;

public interface FeatureProvider {

    FeatureGroup group();

    /** Every key returned must belong to {@link #group()}. */
    Map<FeatureName, FeatureValue> compute(FeatureInput input);
}
