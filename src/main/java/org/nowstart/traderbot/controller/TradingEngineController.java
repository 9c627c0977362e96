package org.nowstart.traderbot.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.traderbot.data.dto.AccountInfo;
import org.nowstart.traderbot.data.dto.LedgerSnapshot;
import org.nowstart.traderbot.data.dto.SessionStatusDto;
import org.nowstart.traderbot.data.dto.StartSessionRequest;
import org.nowstart.traderbot.data.dto.StrategyInfoDto;
import org.nowstart.traderbot.data.dto.TradeRecord;
import org.nowstart.traderbot.data.type.ExecutionMode;
import org.nowstart.traderbot.service.TradingSessionService;
import org.nowstart.traderbot.strategy.StrategyRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Tag(name = "Engine", description = "Strategy catalog, live/paper strategy sessions and order sink passthrough")
public class TradingEngineController {

    private final StrategyRegistry strategyRegistry;
    private final TradingSessionService tradingSessionService;

    @GetMapping("/strategies")
    @Operation(summary = "List strategies", description = "Registered strategies with their descriptions and options.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK")
    })
    public List<StrategyInfoDto> getStrategies() {
        return strategyRegistry.describe();
    }

    @PostMapping("/sessions")
    @Operation(summary = "Start session", description = "Starts a strategy on a live market data feed for one (mode, symbol).")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session started"),
            @ApiResponse(responseCode = "400", description = "Invalid request or strategy parameters"),
            @ApiResponse(responseCode = "404", description = "Unknown strategy"),
            @ApiResponse(responseCode = "409", description = "A strategy is already running for this mode and symbol"),
            @ApiResponse(responseCode = "503", description = "Market data source or order sink not configured")
    })
    public ResponseEntity<SessionStatusDto> startSession(@RequestBody @Valid StartSessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tradingSessionService.start(request));
    }

    @GetMapping("/sessions")
    @Operation(summary = "List sessions", description = "Running and stopped sessions with their ledger totals.")
    public List<SessionStatusDto> getSessions() {
        return tradingSessionService.list();
    }

    @PostMapping("/sessions/{mode}/{symbol}/stop")
    @Operation(summary = "Stop session", description = "Stops the session after the bar in flight is processed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Stopped"),
            @ApiResponse(responseCode = "404", description = "No session")
    })
    public SessionStatusDto stopSession(@PathVariable ExecutionMode mode, @PathVariable String symbol) {
        return tradingSessionService.stop(mode, symbol);
    }

    @GetMapping("/sessions/{mode}/{symbol}/ledger")
    @Operation(summary = "Session ledger", description = "Balance, open positions, closed trades and fills of a session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "404", description = "No session")
    })
    public LedgerSnapshot getLedger(@PathVariable ExecutionMode mode, @PathVariable String symbol) {
        return tradingSessionService.ledger(mode, symbol);
    }

    @GetMapping("/account")
    @Operation(summary = "Exchange account", description = "Account balances reported by the order sink.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "502", description = "Order sink call failed"),
            @ApiResponse(responseCode = "503", description = "Order sink not configured")
    })
    public AccountInfo getAccount() {
        return tradingSessionService.account();
    }

    @GetMapping("/trades")
    @Operation(summary = "Exchange trades", description = "Trade history for a symbol reported by the order sink.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "502", description = "Order sink call failed"),
            @ApiResponse(responseCode = "503", description = "Order sink not configured")
    })
    public List<TradeRecord> getTrades(@RequestParam("symbol") String symbol) {
        return tradingSessionService.trades(symbol);
    }
}
