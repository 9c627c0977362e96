package org.nowstart.traderbot.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.traderbot.data.dto.BacktestStatusDto;
import org.nowstart.traderbot.data.dto.LoadBacktestRequest;
import org.nowstart.traderbot.data.dto.SeekBacktestRequest;
import org.nowstart.traderbot.service.BacktestService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/backtests")
@RequiredArgsConstructor
@Tag(name = "Backtest", description = "Historical replay of a strategy with playback controls")
public class BacktestController {

    private final BacktestService backtestService;

    @PostMapping
    @Operation(summary = "Load backtest", description = "Fetches the historical bar range once and prepares a replay.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Loaded"),
            @ApiResponse(responseCode = "400", description = "Invalid request or strategy parameters"),
            @ApiResponse(responseCode = "502", description = "History could not be fetched"),
            @ApiResponse(responseCode = "503", description = "Market data source not configured")
    })
    public ResponseEntity<BacktestStatusDto> load(@RequestBody @Valid LoadBacktestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(backtestService.load(request));
    }

    @GetMapping
    @Operation(summary = "List backtests")
    public List<BacktestStatusDto> list() {
        return backtestService.list();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Backtest status", description = "State, cursor and summary of a backtest.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "404", description = "No backtest")
    })
    public BacktestStatusDto get(@PathVariable String id) {
        return backtestService.get(id);
    }

    @PostMapping("/{id}/start")
    @Operation(summary = "Start or resume", description = "Replays from the cursor on the backtest executor.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Running"),
            @ApiResponse(responseCode = "409", description = "Not LOADED or PAUSED")
    })
    public BacktestStatusDto start(@PathVariable String id) {
        return backtestService.start(id);
    }

    @PostMapping("/{id}/pause")
    @Operation(summary = "Pause", description = "Freezes the cursor before the next bar.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Paused"),
            @ApiResponse(responseCode = "409", description = "Not RUNNING")
    })
    public BacktestStatusDto pause(@PathVariable String id) {
        return backtestService.pause(id);
    }

    @PostMapping("/{id}/stop")
    @Operation(summary = "Stop", description = "Finishes the backtest at the current cursor.")
    public BacktestStatusDto stop(@PathVariable String id) {
        return backtestService.stop(id);
    }

    @PostMapping("/{id}/seek")
    @Operation(summary = "Seek forward", description = "Advances to a bar index or time, processing every bar on the way.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Moved"),
            @ApiResponse(responseCode = "400", description = "Backward or out of range target"),
            @ApiResponse(responseCode = "409", description = "Not PAUSED or FINISHED")
    })
    public BacktestStatusDto seek(@PathVariable String id, @RequestBody @Valid SeekBacktestRequest request) {
        return backtestService.seek(id, request);
    }

    @PostMapping("/{id}/skip")
    @Operation(summary = "Skip bars", description = "Advances the cursor by count bars, processing each of them.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Moved"),
            @ApiResponse(responseCode = "409", description = "Not PAUSED or FINISHED")
    })
    public BacktestStatusDto skip(@PathVariable String id, @RequestParam(value = "count", defaultValue = "1") int count) {
        return backtestService.skip(id, count);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete backtest", description = "Stops the backtest and discards it.")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        backtestService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
