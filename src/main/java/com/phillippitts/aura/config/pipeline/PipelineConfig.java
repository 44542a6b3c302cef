package com.phillippitts.aura.config.pipeline;

import com.phillippitts.aura.config.ThreadPoolConfig;
import com.phillippitts.aura.config.client.ClientConfig;
import com.phillippitts.aura.config.properties.LexiconProperties;
import com.phillippitts.aura.config.properties.PatientStoreProperties;
import com.phillippitts.aura.config.properties.PipelineProperties;
import com.phillippitts.aura.service.collaborator.CritiqueGenerator;
import com.phillippitts.aura.service.collaborator.DrugInteractionChecker;
import com.phillippitts.aura.service.collaborator.EvidenceSearch;
import com.phillippitts.aura.service.collaborator.ImageAnalyzer;
import com.phillippitts.aura.service.collaborator.PatientRecordLookup;
import com.phillippitts.aura.service.collaborator.ReportGenerator;
import com.phillippitts.aura.service.collaborator.SymptomExtractor;
import com.phillippitts.aura.service.collaborator.local.JsonPatientRecordLookup;
import com.phillippitts.aura.service.collaborator.local.RuleBasedDrugInteractionChecker;
import com.phillippitts.aura.service.lexicon.ClinicalLexicon;
import com.phillippitts.aura.service.lexicon.ClinicalLexiconLoader;
import com.phillippitts.aura.service.lexicon.LexiconMatcher;
import com.phillippitts.aura.service.metrics.PipelineMetrics;
import com.phillippitts.aura.service.pipeline.DefaultDiagnosticPipeline;
import com.phillippitts.aura.service.pipeline.DiagnosticPipeline;
import com.phillippitts.aura.service.pipeline.EvidencePhase;
import com.phillippitts.aura.service.pipeline.SafetyCheckStep;
import com.phillippitts.aura.service.pipeline.StepRunner;
import com.phillippitts.aura.service.query.SearchQueryBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.concurrent.Executor;

/**
 * Wires the diagnostic pipeline explicitly. The three {@link EvidenceSearch} beans share a
 * type, so each is selected by qualifier.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public ClinicalLexicon clinicalLexicon(ResourceLoader resourceLoader, LexiconProperties props) {
        return ClinicalLexiconLoader.loadOrFallback(resourceLoader.getResource(props.location()));
    }

    @Bean
    public LexiconMatcher lexiconMatcher(ClinicalLexicon lexicon, LexiconProperties props) {
        return new LexiconMatcher(lexicon, props.matchThreshold());
    }

    @Bean
    public SearchQueryBuilder searchQueryBuilder(LexiconMatcher matcher) {
        return new SearchQueryBuilder(matcher);
    }

    @Bean
    public PatientRecordLookup patientRecordLookup(ResourceLoader resourceLoader, PatientStoreProperties props) {
        return JsonPatientRecordLookup.fromResource(resourceLoader.getResource(props.location()));
    }

    @Bean
    public DrugInteractionChecker drugInteractionChecker() {
        return new RuleBasedDrugInteractionChecker();
    }

    @Bean
    public SafetyCheckStep safetyCheckStep(DrugInteractionChecker checker) {
        return new SafetyCheckStep(checker);
    }

    @Bean
    public EvidencePhase evidencePhase(@Qualifier(ClientConfig.LITERATURE_SEARCH) EvidenceSearch literature,
                                       @Qualifier(ClientConfig.BROAD_SEARCH) EvidenceSearch broad,
                                       @Qualifier(ClientConfig.CASE_SEARCH) EvidenceSearch cases,
                                       ImageAnalyzer imageAnalyzer,
                                       SearchQueryBuilder queryBuilder,
                                       StepRunner stepRunner,
                                       @Qualifier(ThreadPoolConfig.EVIDENCE_EXECUTOR) Executor executor,
                                       PipelineProperties props) {
        return new EvidencePhase(literature, broad, cases, imageAnalyzer, queryBuilder, stepRunner, executor, props);
    }

    @Bean
    public DiagnosticPipeline diagnosticPipeline(SymptomExtractor symptomExtractor,
                                                 PatientRecordLookup patientLookup,
                                                 EvidencePhase evidencePhase,
                                                 CritiqueGenerator critiqueGenerator,
                                                 ReportGenerator reportGenerator,
                                                 SafetyCheckStep safetyCheckStep,
                                                 StepRunner stepRunner,
                                                 ApplicationEventPublisher publisher,
                                                 PipelineMetrics metrics,
                                                 PipelineProperties props) {
        return new DefaultDiagnosticPipeline(symptomExtractor, patientLookup, evidencePhase,
                critiqueGenerator, reportGenerator, safetyCheckStep, stepRunner, publisher, metrics, props);
    }
}
