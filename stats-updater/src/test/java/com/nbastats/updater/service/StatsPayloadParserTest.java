package com.nbastats.updater.service;

import com.nbastats.updater.exception.PermanentDataException;
import com.nbastats.updater.model.Game;
import com.nbastats.updater.model.PlayerGameStats;
import com.nbastats.updater.model.StatsResponse;
import com.nbastats.updater.service.StatsPayloadParser.BoxScoreLine;
import com.nbastats.updater.service.StatsPayloadParser.RosterEntry;
import com.nbastats.updater.service.StatsPayloadParser.ScheduledGame;
import com.nbastats.updater.service.StatsPayloadParser.StandingsEntry;
import com.nbastats.updater.service.StatsPayloadParser.TeamInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.nbastats.updater.support.StatsFixtures.boxScoreRow;
import static com.nbastats.updater.support.StatsFixtures.gameLogPair;
import static com.nbastats.updater.support.StatsFixtures.response;
import static com.nbastats.updater.support.StatsFixtures.responseWithRows;
import static com.nbastats.updater.support.StatsFixtures.rosterRow;
import static com.nbastats.updater.support.StatsFixtures.row;
import static com.nbastats.updater.support.StatsFixtures.standingsRow;
import static com.nbastats.updater.support.StatsFixtures.teamInfo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatsPayloadParserTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 15);

    private final StatsPayloadParser parser = new StatsPayloadParser();

    @Test
    void should_ParseStandings() {
        List<StandingsEntry> entries = parser.parseStandings(response("Standings",
                standingsRow(1610612738L, "Boston", "Celtics", 64, 18),
                standingsRow(1610612752L, "New York", "Knicks", 50, 32)));

        assertThat(entries).hasSize(2);
        assertThat(entries.get(0)).isEqualTo(
                new StandingsEntry(1610612738L, "Boston Celtics", "East", "Atlantic", 64, 18));
    }

    @Test
    void should_RejectStandingsRow_When_TeamIdMissing() {
        StatsResponse payload = response("Standings", row(15, 3, "Boston", 4, "Celtics"));

        assertThatThrownBy(() -> parser.parseStandings(payload))
                .isInstanceOf(PermanentDataException.class)
                .hasMessageContaining("TeamID");
    }

    @Test
    void should_ParseTeamInfo() {
        TeamInfo info = parser.parseTeamInfo(teamInfo(1610612738L, "Boston", "Celtics", "BOS"));

        assertThat(info.teamId()).isEqualTo(1610612738L);
        assertThat(info.name()).isEqualTo("Boston Celtics");
        assertThat(info.abbreviation()).isEqualTo("BOS");
        assertThat(info.conference()).isEqualTo("East");
    }

    @Test
    void should_RejectTeamInfo_When_NoRows() {
        assertThatThrownBy(() -> parser.parseTeamInfo(response("TeamInfoCommon")))
                .isInstanceOf(PermanentDataException.class);
    }

    @Test
    void should_ParseRosterAndCleanFields() {
        List<RosterEntry> roster = parser.parseRoster(response("CommonTeamRoster",
                rosterRow(1610612738L, 1628369L, "Jayson Tatum", "#0", "F-G"),
                rosterRow(1610612738L, 1627759L, "Jaylen Brown", "7", "Guard")));

        assertThat(roster).containsExactly(
                new RosterEntry(1610612738L, 1628369L, "Jayson Tatum", "0", "F-G"),
                new RosterEntry(1610612738L, 1627759L, "Jaylen Brown", "7", null));
    }

    @Test
    void should_AcceptNumericStringIds() {
        List<RosterEntry> roster = parser.parseRoster(response("CommonTeamRoster",
                row(15, 0, "1610612738", 3, "Al Horford", 14, "201143")));

        assertThat(roster).containsExactly(new RosterEntry(1610612738L, 201143L, "Al Horford", null, null));
    }

    @Test
    void should_RejectRosterRow_When_PlayerIdMissing() {
        StatsResponse payload = response("CommonTeamRoster",
                rosterRow(1610612738L, 201143L, "Al Horford", "42", "C").subList(0, 14));

        assertThatThrownBy(() -> parser.parseRoster(payload))
                .isInstanceOf(PermanentDataException.class)
                .hasMessageContaining("PLAYER_ID");
    }

    @Test
    void should_PairGameLogRowsIntoGames() {
        List<List<Object>> rows = new ArrayList<>();
        rows.addAll(gameLogPair("0022300061", "2023-10-25", 1610612752L, "NYK", 104, 1610612738L, "BOS", 108));
        rows.addAll(gameLogPair("0022300700", "2024-02-01", 1610612738L, "BOS", null, 1610612752L, "NYK", null));

        List<ScheduledGame> games = parser.parseGameLog(responseWithRows("LeagueGameLog", rows), TODAY);

        assertThat(games).hasSize(2);
        ScheduledGame played = games.get(0);
        assertThat(played.gameId()).isEqualTo("0022300061");
        assertThat(played.gameDate()).isEqualTo(LocalDate.of(2023, 10, 25));
        assertThat(played.homeTeamId()).isEqualTo(1610612752L);
        assertThat(played.awayTeamId()).isEqualTo(1610612738L);
        assertThat(played.homeScore()).isEqualTo(104);
        assertThat(played.awayScore()).isEqualTo(108);
        assertThat(played.status()).isEqualTo(Game.STATUS_COMPLETED);
        assertThat(played.playoffRound()).isNull();

        assertThat(games.get(1).status()).isEqualTo(Game.STATUS_UPCOMING);
        assertThat(games.get(1).homeScore()).isNull();
    }

    @Test
    void should_MarkTodaysUnfinishedGameLive() {
        List<ScheduledGame> games = parser.parseGameLog(responseWithRows("LeagueGameLog",
                gameLogPair("0022300600", "2024-01-15", 1610612738L, "BOS", null, 1610612752L, "NYK", null)), TODAY);

        assertThat(games).singleElement().extracting(ScheduledGame::status).isEqualTo(Game.STATUS_LIVE);
    }

    @Test
    void should_SkipGame_When_OpponentRowMissing() {
        List<Object> homeOnly = gameLogPair("0022300061", "2023-10-25",
                1610612752L, "NYK", 104, 1610612738L, "BOS", 108).get(0);

        List<ScheduledGame> games = parser.parseGameLog(response("LeagueGameLog", homeOnly), TODAY);

        assertThat(games).isEmpty();
    }

    @Test
    void should_ParseLongFormGameDates() {
        List<ScheduledGame> games = parser.parseGameLog(responseWithRows("LeagueGameLog",
                gameLogPair("0022300061", "OCT 25, 2023", 1610612752L, "NYK", 104, 1610612738L, "BOS", 108)), TODAY);

        assertThat(games.get(0).gameDate()).isEqualTo(LocalDate.of(2023, 10, 25));
    }

    @Test
    void should_RejectUnparseableGameDate() {
        StatsResponse payload = responseWithRows("LeagueGameLog",
                gameLogPair("0022300061", "yesterday", 1610612752L, "NYK", 104, 1610612738L, "BOS", 108));

        assertThatThrownBy(() -> parser.parseGameLog(payload, TODAY))
                .isInstanceOf(PermanentDataException.class)
                .hasMessageContaining("GAME_DATE");
    }

    @Test
    void should_ParseBoxScoreLines() {
        StatsResponse payload = response("PlayerStats",
                boxScoreRow("0022300061", 1610612738L, 1628369L, "Jayson Tatum", "36.000000:12", 34));

        List<BoxScoreLine> lines = parser.parseBoxScore(payload);

        assertThat(lines).hasSize(1);
        PlayerGameStats stats = lines.get(0).stats();
        assertThat(lines.get(0).playerName()).isEqualTo("Jayson Tatum");
        assertThat(stats.getGameId()).isEqualTo("0022300061");
        assertThat(stats.getPlayerId()).isEqualTo(1628369L);
        assertThat(stats.getTeamId()).isEqualTo(1610612738L);
        assertThat(stats.getMinutes()).isEqualTo("36:12");
        assertThat(stats.getPoints()).isEqualTo(34);
        assertThat(stats.getRebounds()).isEqualTo(7);
        assertThat(stats.getFgPct()).isEqualTo(0.533);
        assertThat(stats.getTpm()).isEqualTo(2);
        assertThat(stats.getPlusMinus()).isEqualTo(6);
    }

    @Test
    void should_RejectBoxScore_When_PlayerStatsMissing() {
        assertThatThrownBy(() -> parser.parseBoxScore(response("TeamStats")))
                .isInstanceOf(PermanentDataException.class)
                .hasMessageContaining("PlayerStats");
    }

    @ParameterizedTest
    @CsvSource({
            "0042300101, First Round",
            "0042300213, Conference Semifinals",
            "0042300305, Conference Finals",
            "0042300401, NBA Finals",
            "42300401,   NBA Finals"
    })
    void should_DerivePlayoffRoundFromGameId(String gameId, String round) {
        assertThat(StatsPayloadParser.playoffRound(gameId)).isEqualTo(round);
    }

    @Test
    void should_ReturnNoRound_When_NotPlayoffGame() {
        assertThat(StatsPayloadParser.playoffRound("0022300061")).isNull();
        assertThat(StatsPayloadParser.playoffRound("0012300001")).isNull();
        assertThat(StatsPayloadParser.playoffRound("")).isNull();
    }

    @ParameterizedTest
    @CsvSource(value = {
            "34:12, 34:12",
            "34.000000:07, 34:07",
            "5:3, 05:03",
            "24.5, 24:30",
            "'', 00:00",
            "DNP, 00:00"
    })
    void should_NormaliseMinutes(String raw, String expected) {
        assertThat(StatsPayloadParser.normaliseMinutes(raw)).isEqualTo(expected);
    }

    @Test
    void should_DefaultMinutes_When_Null() {
        assertThat(StatsPayloadParser.normaliseMinutes(null)).isEqualTo("00:00");
    }

    @Test
    void should_KeepOnlyKnownPositionsAndJerseyDigits() {
        assertThat(StatsPayloadParser.cleanPosition(" c-f ")).isEqualTo("C-F");
        assertThat(StatsPayloadParser.cleanPosition("PG")).isNull();
        assertThat(StatsPayloadParser.cleanJersey("#11")).isEqualTo("11");
        assertThat(StatsPayloadParser.cleanJersey("")).isNull();
        assertThat(StatsPayloadParser.cleanJersey(null)).isNull();
    }
}
