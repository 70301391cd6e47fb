package com.nbastats.updater.repository;

import com.nbastats.updater.model.Game;
import com.nbastats.updater.model.Player;
import com.nbastats.updater.model.PlayerGameStats;
import com.nbastats.updater.model.Team;

import java.util.List;
import java.util.Optional;

/**
 * Lookup-by-natural-key and save operations for ingested entities.
 * Save is an upsert: it creates the row or overwrites every column of the existing one.
 */
public interface EntityStore {

    Optional<Team> findTeam(long teamId);

    List<Long> findAllTeamIds();

    void saveTeam(Team team);

    Optional<Player> findPlayer(long playerId);

    void savePlayer(Player player);

    Optional<Game> findGame(String gameId);

    void saveGame(Game game);

    Optional<PlayerGameStats> findPlayerGameStats(long playerId, String gameId, long teamId);

    void savePlayerGameStats(PlayerGameStats stats);

    int countPlayerGameStats(String gameId);

    /**
     * Delete games (and their stats) from seasons before {@code previousSeason}, plus the
     * regular-season games of {@code previousSeason} itself. Its playoff games are kept.
     *
     * @return number of games deleted
     */
    int deleteGamesBefore(String previousSeason);
}
