package com.sdmahjong.service;

import com.sdmahjong.ai.BaselineStrategy;
import com.sdmahjong.ai.SeatStrategy;
import com.sdmahjong.config.MahjongProperties;
import com.sdmahjong.engine.GameEngine;
import com.sdmahjong.engine.GameState;
import com.sdmahjong.model.TileAlphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 批量对局模拟：四家都用基础策略，多线程并行，第 i 局的种子为 baseSeed + i
 */
@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final MahjongProperties properties;

    public SimulationService(MahjongProperties properties) {
        this.properties = properties;
    }

    /**
     * 按配置的局数和种子模拟
     */
    public SimulationSummary runDefault() {
        return run(properties.getSimulation().getRounds(), properties.getSimulation().getBaseSeed());
    }

    public SimulationSummary run(int rounds, long baseSeed) {
        if (rounds <= 0) {
            throw new IllegalArgumentException("局数必须大于 0：" + rounds);
        }
        int maxRounds = properties.getSimulation().getMaxRounds();
        if (rounds > maxRounds) {
            throw new IllegalArgumentException("局数不能超过 " + maxRounds + "：" + rounds);
        }
        TileAlphabet alphabet = properties.tileAlphabet();
        int maxTurns = properties.getMaxTurns();
        int threads = Math.max(1, properties.getSimulation().getThreads());
        log.info("开始模拟 {} 局，起始种子={}，线程数={}", rounds, baseSeed, threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<GameState>> futures = new ArrayList<>(rounds);
            for (int i = 0; i < rounds; i++) {
                final long seed = baseSeed + i;
                futures.add(executor.submit(new Callable<GameState>() {
                    @Override
                    public GameState call() {
                        return newDriver(maxTurns).play(alphabet, seed);
                    }
                }));
            }

            SimulationSummary summary = new SimulationSummary();
            for (Future<GameState> future : futures) {
                summary.record(future.get());
            }
            log.info("模拟结束：{}", summary);
            return summary;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("模拟被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("模拟失败", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private RoundDriver newDriver(int maxTurns) {
        List<SeatStrategy> strategies = new ArrayList<>();
        for (int i = 0; i < GameState.SEAT_COUNT; i++) {
            strategies.add(new BaselineStrategy());
        }
        return new RoundDriver(new GameEngine(), strategies, maxTurns);
    }
}
