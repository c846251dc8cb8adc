package xorgconf.sections;

import lombok.Data;
import lombok.experimental.Accessors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pointer acceleration and layout options shared by {@code InputDevice} and {@code InputClass}
 * sections. All of them render as {@code Option} lines.
 */
@Data
@Accessors(chain = true)
public class InputProperties {

    private Boolean autoServerLayout;
    private Boolean floating;
    /**
     * Nine space-separated floats, row-major.
     */
    private String transformationMatrix;
    private Integer accelerationProfile;
    private Double constantDeceleration;
    private Double adaptiveDeceleration;
    private String accelerationScheme;
    private Integer accelerationNumerator;
    private Integer accelerationDenominator;
    private Integer accelerationThreshold;

    Map<String, Object> toOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("AutoServerLayout", autoServerLayout);
        options.put("Floating", floating);
        options.put("TransformationMatrix", transformationMatrix);
        options.put("AccelerationProfile", accelerationProfile);
        options.put("ConstantDeceleration", constantDeceleration);
        options.put("AdaptiveDeceleration", adaptiveDeceleration);
        options.put("AccelerationScheme", accelerationScheme);
        options.put("AccelerationNumerator", accelerationNumerator);
        options.put("AccelerationDenominator", accelerationDenominator);
        options.put("AccelerationThreshold", accelerationThreshold);
        return options;
    }
}
