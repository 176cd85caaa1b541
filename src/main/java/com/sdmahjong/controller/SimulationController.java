package com.sdmahjong.controller;

import com.sdmahjong.service.SimulationService;
import com.sdmahjong.service.SimulationSummary;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * 批量模拟接口
 */
@Controller
public class SimulationController {

    private final SimulationService simulationService;

    public SimulationController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @PostMapping("/api/simulation/run")
    @ResponseBody
    public SimulationSummary run(@RequestBody SimulationRequest request) {
        return simulationService.run(request.getRounds(), request.getBaseSeed());
    }

    public static class SimulationRequest {
        private int rounds = 100;
        private long baseSeed = 20240101L;

        public int getRounds() { return rounds; }
        public void setRounds(int rounds) { this.rounds = rounds; }
        public long getBaseSeed() { return baseSeed; }
        public void setBaseSeed(long baseSeed) { this.baseSeed = baseSeed; }
    }
}
