package com.ttennebkram.trackpipe.transforms;

import com.ttennebkram.trackpipe.model.ParameterSpec;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Brightness gain in percent, saturating at the type's range.
 */
public class GainTransform extends MatTransform {

    private static final List<ParameterSpec> PARAMS = List.of(
        ParameterSpec.of("gain %", 0, 400, 100)
    );

    public GainTransform() {
        super(PARAMS);
    }

    @Override
    public String getDescription() {
        return "Gain\nsrc.convertTo(dst, -1, alpha)";
    }

    @Override
    protected Mat draw(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }
        Mat output = new Mat();
        input.convertTo(output, -1, value("gain %") / 100.0);
        return output;
    }
}
