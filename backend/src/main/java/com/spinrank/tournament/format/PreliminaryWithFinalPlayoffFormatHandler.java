package com.spinrank.tournament.format;

import com.spinrank.tournament.config.SpinrankRuntimeProperties;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.repository.InMemoryTournamentRepository;
import com.spinrank.tournament.service.PreliminaryQualificationService;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PreliminaryWithFinalPlayoffFormatHandler extends AbstractPreliminaryFormatHandler {

    private final PlayoffFormatHandler playoffHandler;

    public PreliminaryWithFinalPlayoffFormatHandler(
            InMemoryTournamentRepository repository,
            RoundRobinFormatHandler groupHandler,
            PreliminaryQualificationService qualificationService,
            SpinrankRuntimeProperties properties,
            PlayoffFormatHandler playoffHandler
    ) {
        super(repository, groupHandler, qualificationService, properties);
        this.playoffHandler = playoffHandler;
    }

    @Override
    public TournamentFormat format() {
        return TournamentFormat.PRELIMINARY_WITH_FINAL_PLAYOFF;
    }

    @Override
    protected TournamentFormat finalFormat() {
        return TournamentFormat.PLAYOFF;
    }

    @Override
    protected int defaultFinalSize() {
        return properties.getPreliminary().getDefaultFinalPlayoffSize();
    }

    @Override
    protected TournamentFormatHandler finalHandler() {
        return playoffHandler;
    }

    @Override
    protected void initializeFinal(Tournament finalStage, List<Participant> seedOrder) {
        playoffHandler.initializeSeeded(finalStage, seedOrder);
    }

    @Override
    protected int expectedFinalMatches(int finalSize) {
        return finalSize - 1;
    }
}
