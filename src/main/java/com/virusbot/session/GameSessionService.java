package com.virusbot.session;

import com.virusbot.config.BotProperties;
import com.virusbot.model.Move;
import com.virusbot.model.TurnState;
import com.virusbot.protocol.AcceptChallengeCommand;
import com.virusbot.protocol.ChallengeMessage;
import com.virusbot.protocol.CreateLobbyCommand;
import com.virusbot.protocol.GameEndMessage;
import com.virusbot.protocol.GameStartMessage;
import com.virusbot.protocol.JoinLobbyCommand;
import com.virusbot.protocol.MoveCommand;
import com.virusbot.protocol.MoveMadeMessage;
import com.virusbot.protocol.ServerMessage;
import com.virusbot.protocol.TurnChangeMessage;
import com.virusbot.protocol.UnknownMessage;
import com.virusbot.protocol.UsersUpdateMessage;
import com.virusbot.protocol.WelcomeMessage;
import com.virusbot.strategy.BotStrategy;
import com.virusbot.strategy.BotStrategyFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reacts to server messages: lobby and challenge handling, keeping the {@link GameSession}
 * current, and playing the bot's turns.
 * <p>
 * Turns run on a single background thread so the connection keeps reading updates while
 * the strategy thinks. At most one turn runs at a time.
 */
@Service
@Slf4j
public class GameSessionService {

    private final BotProperties properties;
    private final BotStrategyFactory strategyFactory;
    private final Executor turnExecutor;

    private final AtomicReference<GameSession> session = new AtomicReference<>();
    private final AtomicBoolean turnInProgress = new AtomicBoolean(false);
    private final AtomicBoolean turnRequested = new AtomicBoolean(false);

    private volatile String userId;

    @Autowired
    public GameSessionService(BotProperties properties, BotStrategyFactory strategyFactory) {
        this(properties, strategyFactory, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "virusbot-turn");
            thread.setDaemon(true);
            return thread;
        }));
    }

    GameSessionService(BotProperties properties, BotStrategyFactory strategyFactory, Executor turnExecutor) {
        this.properties = properties;
        this.strategyFactory = strategyFactory;
        this.turnExecutor = turnExecutor;
    }

    public GameSession getSession() {
        return session.get();
    }

    public String getUserId() {
        return userId;
    }

    /**
     * Handle one decoded server message, replying through {@code channel} where needed.
     */
    public void handle(ServerMessage message, GameChannel channel) {
        switch (message.type()) {
            case WELCOME -> onWelcome((WelcomeMessage) message, channel);
            case CHALLENGE_RECEIVED -> onChallenge((ChallengeMessage) message, channel);
            case GAME_START -> onGameStart((GameStartMessage) message, channel);
            case MOVE_MADE -> onMoveMade((MoveMadeMessage) message, channel);
            case TURN_CHANGE -> onTurnChange((TurnChangeMessage) message, channel);
            case GAME_END -> onGameEnd((GameEndMessage) message);
            case USERS_UPDATE -> log.debug("{} users online", ((UsersUpdateMessage) message).userCount());
            case UNKNOWN -> log.debug("Ignoring message of type '{}'", ((UnknownMessage) message).wireType());
            default -> log.debug("Ignoring {} message", message.type());
        }
    }

    private void onWelcome(WelcomeMessage welcome, GameChannel channel) {
        userId = welcome.userId();
        log.info("Connected as {} (id {})", welcome.username(), welcome.userId());

        if (properties.hasLobbyId()) {
            log.info("Joining lobby {}", properties.getLobbyId());
            channel.send(new JoinLobbyCommand(properties.getLobbyId()));
        } else if (properties.isAutoCreate()) {
            log.info("Creating lobby with board size {}", properties.getLobbyBoardSize());
            channel.send(new CreateLobbyCommand(properties.getLobbyBoardSize()));
        }
    }

    private void onChallenge(ChallengeMessage challenge, GameChannel channel) {
        if (!properties.isAutoAcceptChallenge()) {
            log.info("Challenge {} from {} not accepted (auto-accept disabled)",
                    challenge.challengeId(), challenge.fromUsername());
            return;
        }
        log.info("Accepting challenge {} from {}", challenge.challengeId(), challenge.fromUsername());
        channel.send(new AcceptChallengeCommand(challenge.challengeId()));
    }

    private void onGameStart(GameStartMessage start, GameChannel channel) {
        GameSession game = GameSession.fromGameStart(start,
                properties.getRules().getAdjacency(), properties.getRules().getActionsPerTurn());
        session.set(game);
        log.info("Game {} started, playing as player {}", game.getGameId(), game.getOwnPlayerId());

        if (game.isMyTurn()) {
            scheduleTurn(channel);
        }
    }

    private void onMoveMade(MoveMadeMessage move, GameChannel channel) {
        GameSession game = session.get();
        if (game == null || !game.isSameGame(move.gameId())) {
            log.debug("Ignoring move for unknown game {}", move.gameId());
            return;
        }
        log.debug("Player {} moved to ({}, {}), {} moves left", move.player(), move.row(), move.col(), move.movesLeft());
        if (game.recordMove(move)) {
            scheduleTurn(channel);
        }
    }

    private void onTurnChange(TurnChangeMessage turn, GameChannel channel) {
        GameSession game = session.get();
        if (game == null || !game.isSameGame(turn.gameId())) {
            log.debug("Turn change ignored: no game state");
            return;
        }
        game.changeTurn(turn);
        log.debug("Turn changed to player {}", turn.player());
        if (game.isMyTurn()) {
            scheduleTurn(channel);
        }
    }

    private void onGameEnd(GameEndMessage end) {
        GameSession game = session.getAndSet(null);
        if (game != null && end.winner() == game.getOwnPlayerId()) {
            log.info("Game {} won", game.getGameId());
        } else {
            log.info("Game over, winner: player {} ({})", end.winner(),
                    end.message() == null ? "no message" : end.message());
        }
    }

    private void scheduleTurn(GameChannel channel) {
        if (!turnInProgress.compareAndSet(false, true)) {
            turnRequested.set(true);
            log.debug("Turn already running, will check again when it ends");
            return;
        }
        turnExecutor.execute(() -> runTurn(channel));
    }

    private void runTurn(GameChannel channel) {
        try {
            playTurn(channel);
        } finally {
            turnInProgress.set(false);
        }
        GameSession game = session.get();
        if (turnRequested.getAndSet(false) && game != null && game.isMyTurn()) {
            scheduleTurn(channel);
        }
    }

    /**
     * Asks the configured strategy for the remaining moves of the turn and sends them.
     * Failures are logged; the service stays ready for the next update.
     */
    void playTurn(GameChannel channel) {
        GameSession game = session.get();
        if (game == null || !game.isMyTurn()) {
            return;
        }
        if (!game.isReadyToPlay()) {
            log.debug("Waiting for {} sent moves to be confirmed", game.getUnconfirmedMoves());
            return;
        }
        try {
            BotStrategy strategy = strategyFactory.getDefaultStrategy();
            TurnState state = game.snapshot();
            List<Move> moves = strategy.decideMoves(state, state.getActionsLeft());
            if (moves.isEmpty()) {
                log.info("No legal move for player {}", game.getOwnPlayerId());
                return;
            }
            log.info("Player {} plays {} ({} strategy)", game.getOwnPlayerId(), moves, strategy.getType());

            for (Move move : moves) {
                Thread.sleep(properties.getMoveDelay().toMillis());
                if (session.get() != game || !game.isMyTurn()) {
                    log.info("Turn ended before all moves were sent");
                    break;
                }
                game.moveSent();
                try {
                    channel.send(MoveCommand.of(move.target(), game.getGameId()));
                } catch (RuntimeException e) {
                    game.moveNotSent();
                    throw e;
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Turn interrupted for player {}", game.getOwnPlayerId());
        } catch (RuntimeException e) {
            log.error("Error playing turn for player {}", game.getOwnPlayerId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (turnExecutor instanceof ExecutorService) {
            ((ExecutorService) turnExecutor).shutdownNow();
        }
    }
}
