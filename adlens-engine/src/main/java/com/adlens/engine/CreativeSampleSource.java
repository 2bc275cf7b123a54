package com.adlens.engine;

import com.adlens.model.CreativeSample;

import java.util.List;

/** Existing creatives to show a creative generator. */
public interface CreativeSampleSource {

    List<CreativeSample> creativeSample(int limit) throws Exception;
}
