package com.spinrank.tournament.format;

import com.spinrank.tournament.config.SpinrankRuntimeProperties;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.repository.InMemoryTournamentRepository;
import com.spinrank.tournament.schedule.RoundRobinScheduler;
import com.spinrank.tournament.service.PreliminaryQualificationService;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PreliminaryWithFinalRoundRobinFormatHandler extends AbstractPreliminaryFormatHandler {

    public PreliminaryWithFinalRoundRobinFormatHandler(
            InMemoryTournamentRepository repository,
            RoundRobinFormatHandler groupHandler,
            PreliminaryQualificationService qualificationService,
            SpinrankRuntimeProperties properties
    ) {
        super(repository, groupHandler, qualificationService, properties);
    }

    @Override
    public TournamentFormat format() {
        return TournamentFormat.PRELIMINARY_WITH_FINAL_ROUND_ROBIN;
    }

    @Override
    protected TournamentFormat finalFormat() {
        return TournamentFormat.ROUND_ROBIN;
    }

    @Override
    protected int defaultFinalSize() {
        return properties.getPreliminary().getDefaultFinalRoundRobinSize();
    }

    @Override
    protected TournamentFormatHandler finalHandler() {
        return groupHandler;
    }

    @Override
    protected void initializeFinal(Tournament finalStage, List<Participant> seedOrder) {
        groupHandler.initialize(finalStage, TournamentSetup.defaults());
    }

    @Override
    protected int expectedFinalMatches(int finalSize) {
        return RoundRobinScheduler.expectedMatches(finalSize);
    }
}
