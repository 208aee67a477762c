package com.gamerank.leaderboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameRankApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameRankApplication.class, args);
    }
}
