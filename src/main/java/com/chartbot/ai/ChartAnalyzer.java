package com.chartbot.ai;

import com.chartbot.automation.error.AnalysisProviderException;
import com.chartbot.model.ImageRef;
import com.chartbot.model.Signal;

/**
 * Turns a chart image into a trading signal.
 * The returned signal carries the verdict and the model name; ownership fields are filled by the caller.
 */
public interface ChartAnalyzer {
    Signal analyze(ImageRef image, String selectedModel) throws AnalysisProviderException;
}
