package com.example.demo.factfind.session;

import com.example.demo.factfind.client.GenerationClient;
import com.example.demo.factfind.exception.FormValidationException;
import com.example.demo.factfind.exception.GenerationTransportException;
import com.example.demo.factfind.exception.TemplateLoadingException;
import com.example.demo.factfind.exception.TemplateNotFoundException;
import com.example.demo.factfind.formula.FormulaEvaluator;
import com.example.demo.factfind.formula.NumericValues;
import com.example.demo.factfind.model.CalculatedValue;
import com.example.demo.factfind.model.FormField;
import com.example.demo.factfind.model.FormTemplate;
import com.example.demo.factfind.model.GenerationRequest;
import com.example.demo.factfind.model.GenerationResult;
import com.example.demo.factfind.model.TemplateCatalog;
import com.example.demo.factfind.model.TemplateSummary;
import com.example.demo.factfind.payload.PayloadSanitizer;
import com.example.demo.factfind.payload.SubmissionPayload;
import com.example.demo.factfind.render.OutputRenderer;
import com.example.demo.factfind.render.SafeHtml;
import com.example.demo.factfind.service.TemplateCatalogSource;
import com.example.demo.factfind.value.ValueStore;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * One user's pass through the form: choose a template, fill it in, submit it for
 * generation and read the rendered result.
 *
 * <p>All methods are synchronized; responses from the collaborators are applied under the
 * same lock. At most one submission is in flight. A submission or listing fetch that has
 * been aborted (by selecting another template or disposing the session) is discarded when
 * it completes.
 *
 * <p>Edits throw {@link FormValidationException} for requests that cannot be applied.
 * Listing and submission failures never throw; they are recorded as the error message.
 */
@Slf4j
public class FormSession {
    public static final String NO_TEMPLATE_MESSAGE = "Please choose a scenario before submitting.";
    public static final String SUBMIT_FAILED_MESSAGE = "Something went wrong while contacting the assistant.";
    public static final String LISTING_FAILED_MESSAGE = "Unable to load form templates.";

    private final String id;
    private final TemplateCatalogSource catalogSource;
    private final GenerationClient generationClient;
    private final FormulaEvaluator formulaEvaluator;
    private final PayloadSanitizer payloadSanitizer;
    private final OutputRenderer outputRenderer;
    private final boolean autoSelectFirst;

    private FormSessionState state = FormSessionState.NO_TEMPLATE_SELECTED;
    private TemplateCatalog catalog;
    private FormTemplate template;
    private ValueStore values;
    private String errorMessage;
    private GenerationResult result;
    private SafeHtml resultHtml = SafeHtml.empty();
    private boolean disposed;

    private CompletableFuture<TemplateCatalog> pendingListing;
    private CompletableFuture<GenerationResult> pendingSubmission;
    private CompletableFuture<FormSessionState> submissionOutcome;
    private long submissionTicket;

    public FormSession(String id,
                       TemplateCatalogSource catalogSource,
                       GenerationClient generationClient,
                       FormulaEvaluator formulaEvaluator,
                       PayloadSanitizer payloadSanitizer,
                       OutputRenderer outputRenderer,
                       boolean autoSelectFirst) {
        this.id = id;
        this.catalogSource = catalogSource;
        this.generationClient = generationClient;
        this.formulaEvaluator = formulaEvaluator;
        this.payloadSanitizer = payloadSanitizer;
        this.outputRenderer = outputRenderer;
        this.autoSelectFirst = autoSelectFirst;
    }

    public String getId() {
        return id;
    }

    /**
     * Fetch the template listing. On success the first template is selected when
     * auto-select is on and nothing is selected yet; on failure the session stays without a
     * template and records an error message.
     *
     * @return completes once the listing has been applied (or discarded)
     */
    public synchronized CompletableFuture<FormSessionState> loadTemplates() {
        if (pendingListing != null) {
            pendingListing.cancel(true);
        }
        CompletableFuture<TemplateCatalog> fetch;
        try {
            fetch = catalogSource.fetchCatalog();
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        pendingListing = fetch;
        CompletableFuture<TemplateCatalog> current = fetch;
        return fetch.handle((loaded, error) -> onListing(current, loaded, error));
    }

    private synchronized FormSessionState onListing(CompletableFuture<TemplateCatalog> fetch,
                                                    TemplateCatalog loaded, Throwable error) {
        if (fetch != pendingListing || disposed) {
            return state;
        }
        pendingListing = null;
        if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                return state;
            }
            if (cause instanceof TemplateLoadingException) {
                TemplateLoadingException tle = (TemplateLoadingException) cause;
                log.warn("Session {} could not load templates: {} - {}", id, tle.getCode(), tle.getDescription());
            } else {
                log.warn("Session {} could not load templates", id, cause);
            }
            errorMessage = LISTING_FAILED_MESSAGE;
            return state;
        }
        catalog = loaded;
        if (autoSelectFirst && template == null && !loaded.isEmpty()) {
            selectTemplate(loaded.getTemplates().get(0).getId());
        }
        return state;
    }

    /**
     * Switch to a template with a fresh value store. A submission in flight is aborted.
     *
     * @throws TemplateNotFoundException when the id is not in the loaded listing
     */
    public synchronized void selectTemplate(String templateId) {
        FormTemplate selected = catalog == null ? null : catalog.find(templateId).orElse(null);
        if (selected == null) {
            throw new TemplateNotFoundException(templateId);
        }
        abortSubmission();
        template = selected;
        values = ValueStore.initialize(selected);
        errorMessage = null;
        state = FormSessionState.TEMPLATE_ACTIVE;
        log.info("Session {} selected template {}", id, templateId);
    }

    public synchronized void setField(String key, Object value) {
        edit(store -> store.set(key, value));
    }

    public synchronized void updateItem(String repeaterKey, int index, String subKey, Object value) {
        edit(store -> store.updateItem(repeaterKey, index, subKey, value));
    }

    public synchronized boolean addChip(String repeaterKey, String type) {
        return editReturning(store -> store.addTypedItem(repeaterKey, type));
    }

    public synchronized boolean removeChip(String repeaterKey, String type) {
        return editReturning(store -> store.removeTypedItem(repeaterKey, type));
    }

    public synchronized int setItemCount(String repeaterKey, int count) {
        requireTemplate();
        int size = values.setItemCount(repeaterKey, count);
        markEdited();
        return size;
    }

    public synchronized boolean addSelection(String key, String option) {
        return editReturning(store -> store.addSelection(key, option));
    }

    public synchronized boolean removeSelection(String key, String option) {
        return editReturning(store -> store.removeSelection(key, option));
    }

    public synchronized void clearSelections(String key) {
        edit(store -> store.clearSelections(key));
    }

    /**
     * Evaluate the calculated fields, sanitize the values and send them for generation.
     * Ignored while a submission is already in flight: the outcome of that one is returned.
     *
     * @return completes with the state the submission ended in
     */
    public synchronized CompletableFuture<FormSessionState> submit() {
        if (state == FormSessionState.SUBMITTING) {
            log.debug("Session {} is already submitting; ignoring submit", id);
            return submissionOutcome;
        }
        if (template == null) {
            errorMessage = NO_TEMPLATE_MESSAGE;
            return CompletableFuture.completedFuture(state);
        }

        Map<String, Object> enriched = new LinkedHashMap<>(values.snapshot());
        formulaEvaluator.evaluateAll(template, values)
                .forEach((key, calculated) -> enriched.put(key, NumericValues.parseOrZero(calculated.getValue())));
        SubmissionPayload payload = payloadSanitizer.sanitize(enriched, template.getFieldKinds());
        GenerationRequest request = GenerationRequest.builder()
                .formType(template.getId())
                .formData(payload)
                .build();

        errorMessage = null;
        result = null;
        resultHtml = SafeHtml.empty();
        state = FormSessionState.SUBMITTING;
        long ticket = ++submissionTicket;
        CompletableFuture<FormSessionState> outcome = new CompletableFuture<>();
        submissionOutcome = outcome;
        log.info("Session {} submitting form {} ({} fields)", id, template.getId(), payload.size());
        log.debug("Form data being sent: {}", payload);

        CompletableFuture<GenerationResult> call;
        try {
            call = generationClient.generate(request);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        pendingSubmission = call;
        call.whenComplete((generated, error) -> onSubmissionComplete(ticket, generated, error));
        return outcome;
    }

    private synchronized void onSubmissionComplete(long ticket, GenerationResult generated, Throwable error) {
        if (ticket != submissionTicket || state != FormSessionState.SUBMITTING) {
            log.debug("Session {} discarding response of aborted submission", id);
            return;
        }
        CompletableFuture<FormSessionState> outcome = submissionOutcome;
        pendingSubmission = null;
        submissionOutcome = null;
        if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof GenerationTransportException) {
                GenerationTransportException gte = (GenerationTransportException) cause;
                log.warn("Session {} submission failed: {} (status {})", id, gte.getMessage(), gte.getStatus());
            } else {
                log.warn("Session {} submission failed", id, cause);
            }
            errorMessage = SUBMIT_FAILED_MESSAGE;
            state = FormSessionState.SUBMIT_FAILED;
        } else {
            result = generated;
            resultHtml = outputRenderer.render(generated);
            state = FormSessionState.RESULT_READY;
            log.info("Session {} received generated document ({} chars of HTML)", id, resultHtml.getHtml().length());
        }
        outcome.complete(state);
    }

    /**
     * Abort the submission in flight, if any. Its response is discarded and the session
     * goes back to editing.
     *
     * @return true when a submission was aborted
     */
    public synchronized boolean abortSubmission() {
        if (state != FormSessionState.SUBMITTING) {
            return false;
        }
        submissionTicket++;
        CompletableFuture<GenerationResult> call = pendingSubmission;
        CompletableFuture<FormSessionState> outcome = submissionOutcome;
        pendingSubmission = null;
        submissionOutcome = null;
        state = FormSessionState.TEMPLATE_ACTIVE;
        if (call != null) {
            call.cancel(true);
        }
        log.info("Session {} aborted its submission", id);
        if (outcome != null) {
            outcome.complete(state);
        }
        return true;
    }

    /**
     * Abort any request in flight. The session must not be used afterwards.
     */
    public synchronized void dispose() {
        abortSubmission();
        if (pendingListing != null) {
            pendingListing.cancel(true);
            pendingListing = null;
        }
        disposed = true;
    }

    public synchronized FormSessionState getState() {
        return state;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized FormTemplate getTemplate() {
        return template;
    }

    public synchronized GenerationResult getResult() {
        return result;
    }

    public synchronized SafeHtml getResultHtml() {
        return resultHtml;
    }

    /**
     * Current value of a field, or null when no template is selected
     */
    public synchronized Object getValue(String key) {
        return values == null ? null : values.get(key);
    }

    public synchronized Map<String, CalculatedValue> calculatedValues() {
        if (template == null) return Map.of();
        return formulaEvaluator.evaluateAll(template, values);
    }

    public synchronized FormSessionView view() {
        FormSessionView.FormSessionViewBuilder view = FormSessionView.builder()
                .sessionId(id)
                .state(state)
                .errorMessage(errorMessage)
                .templates(catalog == null ? List.of()
                        : catalog.getTemplates().stream().map(TemplateSummary::of).collect(Collectors.toList()));
        if (template != null) {
            Map<String, List<String>> chips = new LinkedHashMap<>();
            for (FormField field : template.getAllFields()) {
                if (values.isChipRepeater(field.getKey())) {
                    chips.put(field.getKey(), values.availableTypes(field.getKey()));
                }
            }
            view.templateId(template.getId())
                    .templateLabel(template.getLabel())
                    .values(values.snapshot())
                    .calculatedValues(formulaEvaluator.evaluateAll(template, values))
                    .availableChips(chips);
        }
        if (result != null) {
            view.resultHtml(resultHtml.getHtml())
                    .resultLabel(result.getDisplayLabel());
        }
        return view.build();
    }

    private void edit(Consumer<ValueStore> change) {
        requireTemplate();
        change.accept(values);
        markEdited();
    }

    private boolean editReturning(Predicate<ValueStore> change) {
        requireTemplate();
        boolean changed = change.test(values);
        markEdited();
        return changed;
    }

    private void requireTemplate() {
        if (disposed) {
            throw new IllegalStateException("Form session " + id + " has been disposed");
        }
        if (template == null) {
            throw new FormValidationException(FormValidationException.NO_TEMPLATE_SELECTED,
                    "Choose a template before editing fields");
        }
    }

    private void markEdited() {
        if (state == FormSessionState.RESULT_READY || state == FormSessionState.SUBMIT_FAILED) {
            state = FormSessionState.TEMPLATE_ACTIVE;
            errorMessage = null;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
