package fun.fengwk.mph.core.service.matching;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured attributes derived from a product name, any of them may be null.
 *
 * @author fengwk
 */
@Value
@Builder
public class FeatureSet {

    String brand;
    String model;
    String storage;
    String color;
    String category;

    @Builder.Default
    List<String> keySpecs = List.of();

}
