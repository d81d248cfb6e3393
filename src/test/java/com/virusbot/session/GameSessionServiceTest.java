package com.virusbot.session;

import com.virusbot.config.BotProperties;
import com.virusbot.exception.TransportException;
import com.virusbot.model.Move;
import com.virusbot.model.Position;
import com.virusbot.model.TurnState;
import com.virusbot.protocol.AcceptChallengeCommand;
import com.virusbot.protocol.ChallengeMessage;
import com.virusbot.protocol.CreateLobbyCommand;
import com.virusbot.protocol.GameEndMessage;
import com.virusbot.protocol.JoinLobbyCommand;
import com.virusbot.protocol.MoveCommand;
import com.virusbot.protocol.MoveMadeMessage;
import com.virusbot.protocol.OutboundMessage;
import com.virusbot.protocol.TurnChangeMessage;
import com.virusbot.protocol.UnknownMessage;
import com.virusbot.protocol.WelcomeMessage;
import com.virusbot.strategy.BotStrategy;
import com.virusbot.strategy.BotStrategyFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;

import static com.virusbot.session.GameSessionTest.boardStart;
import static com.virusbot.session.GameSessionTest.dimensionsStart;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GameSessionService message handling and turn play.
 * Turns run on the calling thread.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GameSessionServiceTest {

    @Mock private BotStrategyFactory strategyFactory;
    @Mock private BotStrategy strategy;
    @Mock private GameChannel channel;

    private BotProperties properties;
    private GameSessionService service;

    private static final List<Move> THREE_MOVES = List.of(
            Move.grow(new Position(0, 1), new Position(0, 0)),
            Move.grow(new Position(1, 0), new Position(0, 0)),
            Move.grow(new Position(1, 1), new Position(0, 0)));

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.setMoveDelay(Duration.ZERO);
        service = new GameSessionService(properties, strategyFactory, Runnable::run);

        when(strategyFactory.getDefaultStrategy()).thenReturn(strategy);
        when(strategy.decideMoves(any(TurnState.class), anyInt())).thenReturn(THREE_MOVES);
    }

    private List<OutboundMessage> sent(int times) {
        ArgumentCaptor<OutboundMessage> captor = ArgumentCaptor.forClass(OutboundMessage.class);
        verify(channel, times(times)).send(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("Lobby and challenges")
    class LobbyTests {

        @Test
        @DisplayName("welcome joins the configured lobby")
        void joinsLobby() {
            properties.setLobbyId("L-1");

            service.handle(new WelcomeMessage("u-1", "VirusBot"), channel);

            assertEquals(List.of(new JoinLobbyCommand("L-1")), sent(1));
            assertEquals("u-1", service.getUserId());
        }

        @Test
        @DisplayName("welcome creates a lobby when asked to")
        void createsLobby() {
            properties.setAutoCreate(true);

            service.handle(new WelcomeMessage("u-1", "VirusBot"), channel);

            assertEquals(List.of(new CreateLobbyCommand(10)), sent(1));
        }

        @Test
        @DisplayName("welcome sends nothing without lobby settings")
        void idleAfterWelcome() {
            service.handle(new WelcomeMessage("u-1", "VirusBot"), channel);

            verifyNoInteractions(channel);
        }

        @Test
        @DisplayName("challenges are accepted when auto-accept is on")
        void acceptsChallenge() {
            service.handle(new ChallengeMessage("c-9", "u-3", "Alice"), channel);

            assertEquals(List.of(new AcceptChallengeCommand("c-9")), sent(1));
        }

        @Test
        @DisplayName("challenges are ignored when auto-accept is off")
        void ignoresChallenge() {
            properties.setAutoAcceptChallenge(false);

            service.handle(new ChallengeMessage("c-9", "u-3", "Alice"), channel);

            verifyNoInteractions(channel);
        }
    }

    @Nested
    @DisplayName("Turn play")
    class TurnTests {

        @Test
        @DisplayName("game_start on our turn sends the strategy's moves with the game id")
        void playsOnGameStart() {
            service.handle(boardStart(1, 1), channel);

            assertEquals(List.of(
                    new MoveCommand(0, 1, "g-1"),
                    new MoveCommand(1, 0, "g-1"),
                    new MoveCommand(1, 1, "g-1")), sent(3));
        }

        @Test
        @DisplayName("the strategy gets a snapshot of the bot's turn")
        void strategyGetsSnapshot() {
            service.handle(boardStart(1, 1), channel);

            ArgumentCaptor<TurnState> captor = ArgumentCaptor.forClass(TurnState.class);
            verify(strategy).decideMoves(captor.capture(), eq(3));
            assertEquals(1, captor.getValue().getActingPlayerId());
            assertTrue(captor.getValue().isActingPlayersTurn());
        }

        @Test
        @DisplayName("game_start on the opponent's turn waits")
        void waitsForOpponent() {
            service.handle(boardStart(2, 1), channel);

            verifyNoInteractions(strategy);
            verifyNoInteractions(channel);
            assertNotNull(service.getSession());
        }

        @Test
        @DisplayName("the dimensions-only start plays at once")
        void playsOnDimensionsStart() {
            service.handle(dimensionsStart(1, 10), channel);

            assertEquals(new MoveCommand(0, 1, "g-2"), sent(3).get(0));
        }

        @Test
        @DisplayName("the opponent's last move hands us the turn")
        void playsAfterOpponentsLastMove() {
            service.handle(boardStart(2, 1), channel);

            service.handle(new MoveMadeMessage("g-1", 3, 3, 2, 2), channel);
            verifyNoInteractions(channel);

            service.handle(new MoveMadeMessage("g-1", 3, 4, 2, 0), channel);
            sent(3);
        }

        @Test
        @DisplayName("turn_change to us starts a turn")
        void playsOnTurnChange() {
            service.handle(boardStart(2, 1), channel);

            service.handle(new TurnChangeMessage("g-1", 1, 2), channel);

            verify(strategy).decideMoves(any(TurnState.class), eq(2));
            sent(3);
        }

        @Test
        @DisplayName("a turn_change arriving before our moves are echoed does not plan the turn again")
        void noReplanBeforeEchoes() {
            service.handle(boardStart(2, 1), channel);
            service.handle(new MoveMadeMessage("g-1", 3, 4, 2, 0), channel);

            service.handle(new TurnChangeMessage("g-1", 1, 3), channel);

            verify(strategy, times(1)).decideMoves(any(TurnState.class), anyInt());
            sent(3);
            assertEquals(3, service.getSession().getUnconfirmedMoves());
        }

        @Test
        @DisplayName("once our moves are echoed and the opponent has played, the next turn is planned")
        void playsNextTurnAfterEchoes() {
            service.handle(boardStart(2, 1), channel);
            service.handle(new MoveMadeMessage("g-1", 3, 4, 2, 0), channel);
            service.handle(new TurnChangeMessage("g-1", 1, 3), channel);

            service.handle(new MoveMadeMessage("g-1", 0, 1, 1, 2), channel);
            service.handle(new MoveMadeMessage("g-1", 1, 0, 1, 1), channel);
            service.handle(new MoveMadeMessage("g-1", 1, 1, 1, 0), channel);
            service.handle(new TurnChangeMessage("g-1", 2, 3), channel);
            verify(strategy, times(1)).decideMoves(any(TurnState.class), anyInt());

            service.handle(new MoveMadeMessage("g-1", 3, 3, 2, 0), channel);

            verify(strategy, times(2)).decideMoves(any(TurnState.class), anyInt());
            sent(6);
        }

        @Test
        @DisplayName("a failed send does not leave the turn waiting for an echo")
        void failedSendIsNotAwaited() {
            doThrow(new TransportException("connection lost", null))
                    .doNothing()
                    .when(channel).send(any(OutboundMessage.class));

            service.handle(boardStart(1, 1), channel);
            assertEquals(0, service.getSession().getUnconfirmedMoves());

            service.handle(new TurnChangeMessage("g-1", 1, 3), channel);

            verify(strategy, times(2)).decideMoves(any(TurnState.class), anyInt());
        }

        @Test
        @DisplayName("moves of another game are ignored")
        void ignoresOtherGame() {
            service.handle(boardStart(2, 1), channel);

            service.handle(new MoveMadeMessage("other", 3, 4, 2, 0), channel);

            verifyNoInteractions(channel);
            assertFalse(service.getSession().isMyTurn());
        }

        @Test
        @DisplayName("no moves means nothing is sent")
        void nothingToPlay() {
            when(strategy.decideMoves(any(TurnState.class), anyInt())).thenReturn(List.of());

            service.handle(boardStart(1, 1), channel);

            verifyNoInteractions(channel);
        }

        @Test
        @DisplayName("a failing strategy is logged and the next turn still plays")
        void survivesStrategyFailure() {
            when(strategy.decideMoves(any(TurnState.class), anyInt()))
                    .thenThrow(new IllegalStateException("boom"))
                    .thenReturn(THREE_MOVES);

            assertDoesNotThrow(() -> service.handle(boardStart(1, 1), channel));
            verifyNoInteractions(channel);

            service.handle(new TurnChangeMessage("g-1", 1, 3), channel);
            sent(3);
        }
    }

    @Nested
    @DisplayName("Other messages")
    class OtherTests {

        @Test
        @DisplayName("game_end drops the session")
        void gameEndClearsSession() {
            service.handle(boardStart(2, 1), channel);

            service.handle(new GameEndMessage(1, List.of(2), "Player 1 wins"), channel);

            assertNull(service.getSession());
        }

        @Test
        @DisplayName("updates without a game are ignored")
        void updatesWithoutGame() {
            service.handle(new MoveMadeMessage("g-1", 0, 0, 2, 0), channel);
            service.handle(new TurnChangeMessage("g-1", 1, 3), channel);

            verifyNoInteractions(channel);
            verifyNoInteractions(strategy);
        }

        @Test
        @DisplayName("unknown messages are ignored")
        void unknownIgnored() {
            assertDoesNotThrow(() -> service.handle(new UnknownMessage("lobby_update"), channel));
            verifyNoInteractions(channel);
        }
    }
}
