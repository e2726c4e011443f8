package com.mobifone.compute.computeClient;

import com.mobifone.compute.exception.AppException;
import com.mobifone.compute.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ComputeApiStrategyFactory {
    private final List<ComputeApiStrategy> strategies;

    public ComputeApiStrategy getStrategy(String provider) {
        return strategies.stream()
                .filter(strategy -> strategy.isApplicable(provider))
                .findFirst()
                .orElseThrow(() -> new AppException(ErrorCode.COMPUTE_PROVIDER_NOT_FOUND,
                        "No compute strategy found for provider: " + provider));
    }
}
