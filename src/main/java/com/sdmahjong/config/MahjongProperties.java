package com.sdmahjong.config;

import com.sdmahjong.model.TileAlphabet;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 麻将规则与模拟配置（application.yml 中 mahjong.* 前缀）
 */
@Component
@ConfigurationProperties(prefix = "mahjong")
public class MahjongProperties {

    /** 是否加入风牌和箭牌（136 张），默认只用万筒条 108 张 */
    private boolean includeHonors = false;

    /** 一局最多摸牌次数，超过强制荒庄 */
    private int maxTurns = 120;

    private Simulation simulation = new Simulation();

    public boolean isIncludeHonors() {
        return includeHonors;
    }

    public void setIncludeHonors(boolean includeHonors) {
        this.includeHonors = includeHonors;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public void setMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public Simulation getSimulation() {
        return simulation;
    }

    public void setSimulation(Simulation simulation) {
        this.simulation = simulation;
    }

    public TileAlphabet tileAlphabet() {
        return TileAlphabet.of(includeHonors);
    }

    /**
     * 批量模拟配置
     */
    public static class Simulation {

        private int rounds = 100;
        private int threads = 4;
        private long baseSeed = 20240101L;

        /** 单次请求允许的最大局数 */
        private int maxRounds = 10000;

        public int getRounds() {
            return rounds;
        }

        public void setRounds(int rounds) {
            this.rounds = rounds;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public long getBaseSeed() {
            return baseSeed;
        }

        public void setBaseSeed(long baseSeed) {
            this.baseSeed = baseSeed;
        }

        public int getMaxRounds() {
            return maxRounds;
        }

        public void setMaxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
        }
    }
}
