package com.adlens.engine;

import com.adlens.model.CreativeCandidate;
import com.adlens.model.CreativeSample;

import java.util.List;

/**
 * Proposes replacement creatives for a campaign, inspired by existing ones.
 */
public interface CreativeGenerator {

    List<CreativeCandidate> generateForCampaign(String campaign, List<CreativeSample> samples, int count) throws Exception;
}
