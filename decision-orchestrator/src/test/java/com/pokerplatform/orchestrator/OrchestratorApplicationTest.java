package com.pokerplatform.orchestrator;

import com.pokerplatform.common.model.Action;
import com.pokerplatform.common.model.ActionType;
import com.pokerplatform.common.model.GameState;
import com.pokerplatform.common.model.Position;
import com.pokerplatform.common.model.Street;
import com.pokerplatform.common.model.TablePositions;
import com.pokerplatform.orchestrator.adapter.GtoSolver;
import com.pokerplatform.orchestrator.adapter.StrategyBlender;
import com.pokerplatform.orchestrator.adapter.UnavailableGtoSolver;
import com.pokerplatform.orchestrator.config.BudgetSettings;
import com.pokerplatform.orchestrator.service.DecisionCycleOutcome;
import com.pokerplatform.orchestrator.service.DecisionCycleService;
import com.pokerplatform.orchestrator.strategy.GtoWeightedStrategyBlender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {"health.interval-ms=60000", "strategy.alpha=0.7", "budget.gto-default-ms=150"})
class OrchestratorApplicationTest {

    @Autowired
    private DecisionCycleService decisionCycleService;

    @Autowired
    private GtoSolver gtoSolver;

    @Autowired
    private StrategyBlender strategyBlender;

    @Autowired
    private BudgetSettings budgetSettings;

    @Test
    @DisplayName("context wires defaults from properties")
    void defaultsWired() {
        assertInstanceOf(UnavailableGtoSolver.class, gtoSolver);
        assertEquals(0.7, assertInstanceOf(GtoWeightedStrategyBlender.class, strategyBlender).alpha(), 1e-9);
        assertEquals(150, budgetSettings.gtoDefaultMs());
        assertEquals(2000, budgetSettings.totalMs());
    }

    @Test
    @DisplayName("without a solver every cycle still decides, via the safe fallback")
    void cycleWithoutSolver() {
        Action check = Action.of(ActionType.CHECK, Position.BB, Street.PREFLOP);
        GameState state = new GameState("h1", new TablePositions(Position.BB, Position.BTN, Position.SB, Position.BB),
            Map.of(Position.BB, 99.0, Position.SB, 99.5), 1.5, Street.PREFLOP, List.of(check), 1.0, List.of());

        DecisionCycleOutcome outcome = decisionCycleService.runCycle(state, "ctx").block(Duration.ofSeconds(2));

        assertNotNull(outcome);
        assertTrue(outcome.result().solverTimedOut());
        assertEquals(check, outcome.result().decision().action());
    }
}
