package com.example.riskintel.controller;

import com.example.riskintel.propagation.BlastRadiusService;
import com.example.riskintel.propagation.BlastRadiusTicket;
import com.example.riskintel.propagation.PropagationOptions;
import com.example.riskintel.propagation.PropagationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Blast radius queries for visualization and alerting. Unset options fall back to the
 * configured defaults.
 */
@RestController
@RequestMapping("/api/blast-radius")
@RequiredArgsConstructor
public class BlastRadiusController {

    private final BlastRadiusService blastRadiusService;

    /**
     * Returns the precise result when it is cheap or cached, otherwise an approximate
     * estimate ({@code isApproximate=true}) while the precise traversal runs in the background.
     */
    @GetMapping
    public PropagationResult blastRadius(@RequestParam String source,
                                         @RequestParam double score,
                                         @RequestParam(required = false) Integer maxDepth,
                                         @RequestParam(required = false) Double decayFactor,
                                         @RequestParam(required = false) Double minimumPropagationScore,
                                         @RequestParam(required = false) Boolean includeUpstream,
                                         @RequestParam(required = false) Boolean includeDownstream,
                                         @RequestParam(required = false) Integer stepBudget,
                                         @RequestParam(required = false) Long timeBudgetMs,
                                         @RequestParam(required = false) Integer criticalPathLimit) {
        PropagationOptions.PropagationOptionsBuilder options = blastRadiusService.defaultOptions().toBuilder();
        if (maxDepth != null) options.maxDepth(maxDepth);
        if (decayFactor != null) options.decayFactor(decayFactor);
        if (minimumPropagationScore != null) options.minimumPropagationScore(minimumPropagationScore);
        if (includeUpstream != null) options.includeUpstream(includeUpstream);
        if (includeDownstream != null) options.includeDownstream(includeDownstream);
        if (stepBudget != null) options.stepBudget(stepBudget);
        if (timeBudgetMs != null) options.timeBudgetMs(timeBudgetMs);
        if (criticalPathLimit != null) options.criticalPathLimit(criticalPathLimit);

        PropagationOptions resolved = options.build();
        resolved.validate();
        BlastRadiusTicket ticket = blastRadiusService.requestBlastRadius(source, score, resolved);
        return ticket.immediate();
    }
}
