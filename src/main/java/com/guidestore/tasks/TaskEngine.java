package com.guidestore.tasks;

import com.guidestore.AppLogger;
import com.guidestore.DocumentService;
import com.guidestore.addressing.Address;
import com.guidestore.addressing.AddressResolver;
import com.guidestore.addressing.Namespace;
import com.guidestore.archive.ArchiveManager;
import com.guidestore.archive.ArchiveRecord;
import com.guidestore.cache.DocumentRecord;
import com.guidestore.errors.AddressingException;
import com.guidestore.errors.ConflictException;
import com.guidestore.errors.ErrorCode;
import com.guidestore.errors.TaskStateException;
import com.guidestore.sections.Heading;
import com.guidestore.sections.SectionEdit;
import com.guidestore.sections.SectionOperation;
import com.guidestore.sections.SectionTree;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Task workflow over the "Tasks" section of a document. Each task is a direct
 * child heading of that section; its status is a marker line in its body.
 *
 * <p>Two modes:
 * <ul>
 *   <li>sequential ({@code /coordinator/}): the engine picks the next task,
 *       and the document is archived once every task is complete</li>
 *   <li>ad hoc ({@code /docs}): the caller names the task with {@code #slug}</li>
 * </ul>
 */
public class TaskEngine {

    public static final String COORDINATOR_DOCUMENT = "/coordinator/active.md";
    static final String TASKS_SLUG = "tasks";

    private static final AppLogger.Component LOG = AppLogger.forComponent("TaskEngine");

    private final DocumentService documents;
    private final ArchiveManager archives;
    private final Clock clock;

    public TaskEngine(DocumentService documents, ArchiveManager archives, Clock clock) {
        this.documents = documents;
        this.archives = archives;
        this.clock = clock;
    }

    // -------------------------------------------------------------------------
    // Reading
    // -------------------------------------------------------------------------

    /** First heading with slug {@code tasks} or title "Tasks" (any case). */
    public static Optional<Heading> findTasksSection(SectionTree tree) {
        for (Heading h : tree.getHeadings()) {
            if (TASKS_SLUG.equals(h.getSlug()) || "tasks".equalsIgnoreCase(h.getTitle())) {
                return Optional.of(h);
            }
        }
        return Optional.empty();
    }

    /** Tasks in document order; empty when there is no Tasks section. */
    public static List<TaskRecord> getTasks(SectionTree tree) {
        Optional<Heading> tasksSection = findTasksSection(tree);
        if (tasksSection.isEmpty()) {
            return new ArrayList<>();
        }
        return tree.children(tasksSection.get()).stream()
            .map(h -> toRecord(tree, h))
            .collect(Collectors.toList());
    }

    static TaskRecord toRecord(SectionTree tree, Heading heading) {
        String body = tree.readOwnBody(heading.getSlug());
        return new TaskRecord(heading.getSlug(), heading.getPath(), heading.getTitle(), heading.getDepth(),
            statusOf(heading.getSlug(), body), body);
    }

    private static TaskStatus statusOf(String slug, String body) {
        Optional<String> marker = TaskFields.extract(body, "Status");
        if (marker.isEmpty()) {
            return TaskStatus.PENDING;
        }
        return TaskStatus.parse(marker.get()).orElseGet(() -> {
            LOG.warn("Task " + slug + " has unrecognized status '" + marker.get() + "'; treating as pending");
            return TaskStatus.PENDING;
        });
    }

    public List<TaskRecord> listTasks(String rawPath, TaskStatus statusFilter) {
        DocumentRecord record = documents.requireDocument(documents.resolver().resolve(rawPath).documentOnly());
        List<TaskRecord> tasks = getTasks(record.getTree());
        if (statusFilter == null) {
            return tasks;
        }
        return tasks.stream().filter(t -> t.getStatus() == statusFilter).collect(Collectors.toList());
    }

    /**
     * First pending or in-progress task, optionally strictly after
     * {@code afterSlug}. Reads only; repeated calls give the same answer.
     */
    public Optional<TaskRecord> findNextAvailableTask(String rawPath, String afterSlug) {
        DocumentRecord record = documents.requireDocument(documents.resolver().resolve(rawPath).documentOnly());
        return findNextAvailableTask(getTasks(record.getTree()), afterSlug);
    }

    public static Optional<TaskRecord> findNextAvailableTask(List<TaskRecord> tasks, String afterSlug) {
        int start = 0;
        if (afterSlug != null && !afterSlug.isBlank()) {
            String key = AddressResolver.normalizeSlug(afterSlug.startsWith("#") ? afterSlug.substring(1) : afterSlug);
            for (int i = 0; i < tasks.size(); i++) {
                TaskRecord t = tasks.get(i);
                if (t.getSlug().equals(key) || t.getPath().equals(key)) {
                    start = i + 1;
                    break;
                }
            }
        }
        for (int i = start; i < tasks.size(); i++) {
            if (tasks.get(i).getStatus().isActionable()) {
                return Optional.of(tasks.get(i));
            }
        }
        return Optional.empty();
    }

    /** True when there is no Tasks section, no task, or every task is completed. */
    public boolean allTasksComplete(String rawPath) {
        DocumentRecord record = documents.requireDocument(documents.resolver().resolve(rawPath).documentOnly());
        return allTasksComplete(record.getTree());
    }

    public static boolean allTasksComplete(SectionTree tree) {
        return getTasks(tree).stream().allMatch(t -> t.getStatus() == TaskStatus.COMPLETED);
    }

    public TaskSummary summarize(String rawPath, String groupField) {
        return TaskSummary.of(listTasks(rawPath, null), groupField);
    }

    // -------------------------------------------------------------------------
    // Completion
    // -------------------------------------------------------------------------

    /**
     * Marks one task completed and appends {@code - Completed: YYYY-MM-DD}
     * and {@code - Note: ...} to its body.
     */
    public TaskCompletion completeTaskOperation(Address document, String slug, String note) {
        return complete(document.documentOnly(), tree -> requireTask(tree, slug), note);
    }

    /**
     * Sequential mode: completes the first available task of a coordinator
     * document. When that leaves every task complete the document is archived
     * and the result reports where it went.
     */
    public TaskCompletion completeNext(String rawPath, String note, boolean returnNext) {
        String raw = rawPath == null || rawPath.isBlank() ? COORDINATOR_DOCUMENT : rawPath;
        Address address = documents.resolver().resolve(raw);
        if (!address.getNamespace().isSequentialOnly()) {
            throw new AddressingException(ErrorCode.NAMESPACE_VIOLATION,
                "Sequential completion only applies to " + Namespace.COORDINATOR.getPrefix() + " documents",
                Map.of("path", address.getDocumentPath()));
        }
        TaskCompletion completion = complete(address, tree -> {
            Heading tasksHeading = findTasksSection(tree).orElseThrow(() -> noTasksSection(address));
            List<TaskRecord> tasks = getTasks(tree);
            TaskRecord next = findNextAvailableTask(tasks, null).orElseThrow(() ->
                new TaskStateException(ErrorCode.NO_AVAILABLE_TASKS, "No pending tasks in " + address.getDocumentPath(),
                    Map.of("path", address.getDocumentPath(), "tasksSection", tasksHeading.getSlug())));
            return tree.require(next.getSlug());
        }, note);

        if (address.getNamespace().isAutoArchive() && completion.isAllComplete()) {
            try {
                ArchiveRecord archived = archives.archiveCoordinator(address, completion.getVersion());
                completion.setArchive(archived);
            } catch (ConflictException e) {
                LOG.warn(address.getDocumentPath() + " changed after completion; archive skipped");
                completion.setArchiveSkipped("document changed after completion");
            }
        }
        if (returnNext && !completion.isArchived()) {
            completion.setNextTask(findNextAvailableTask(getTasks(completion.getTreeAfter()), completion.getCompletedTask().getSlug())
                .orElse(null));
        }
        return completion;
    }

    /**
     * Ad hoc mode: completes the task named by {@code /doc.md#slug}.
     */
    public TaskCompletion completeTask(String rawAddress, String note, boolean returnNext) {
        Address address = resolveAdHoc(rawAddress);
        TaskCompletion completion = completeTaskOperation(address, address.getSectionSlug(), note);
        if (returnNext) {
            completion.setNextTask(findNextAvailableTask(getTasks(completion.getTreeAfter()), completion.getCompletedTask().getSlug())
                .orElse(null));
        }
        return completion;
    }

    /** pending -> in_progress for the task named by {@code /doc.md#slug}. */
    public TaskRecord startTask(String rawAddress) {
        Address address = resolveAdHoc(rawAddress);
        String slug = address.getSectionSlug();
        DocumentService.Mutation mutation = documents.mutate(address.documentOnly(), tree -> {
            Heading task = requireTask(tree, slug);
            String body = tree.readOwnBody(task.getSlug());
            TaskStatus current = statusOf(task.getSlug(), body);
            requireTransition(task, current, TaskStatus.IN_PROGRESS);
            String updated = TaskFields.replace(body, "Status", TaskStatus.IN_PROGRESS.getValue())
                .orElseGet(() -> "- Status: " + TaskStatus.IN_PROGRESS.getValue() + (body.isEmpty() ? "" : "\n" + body));
            return tree.rewriteOwnBody(task.getSlug(), updated);
        });
        LOG.info("Started " + address);
        return recordAfter(mutation);
    }

    private TaskCompletion complete(Address document, Function<SectionTree, Heading> selector, String note) {
        if (note == null || note.isBlank()) {
            throw AddressingException.missingParameter("note");
        }
        if (note.indexOf('\n') >= 0 || note.indexOf('\r') >= 0) {
            throw AddressingException.invalidParameter("note", "must be a single line");
        }
        String date = LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE);
        DocumentService.Mutation mutation = documents.mutate(document, tree -> {
            Heading task = selector.apply(tree);
            String body = tree.readOwnBody(task.getSlug());
            if (body.isEmpty()) {
                throw new TaskStateException(ErrorCode.TASK_NOT_FOUND,
                    "Task '" + task.getSlug() + "' has no content", Map.of("slug", task.getSlug()));
            }
            TaskStatus current = statusOf(task.getSlug(), body);
            requireTransition(task, current, TaskStatus.COMPLETED);
            String updated = TaskFields.replace(body, "Status", TaskStatus.COMPLETED.getValue())
                .orElseGet(() -> "- Status: " + TaskStatus.COMPLETED.getValue() + "\n" + body);
            updated = updated + "\n- Completed: " + date + "\n- Note: " + note.trim();
            return tree.rewriteOwnBody(task.getSlug(), updated);
        });
        SectionTree after = SectionTree.parse(mutation.getEdit().getContent());
        TaskRecord completed = toRecord(after, after.require(mutation.getEdit().getSlug()));
        TaskCompletion completion = new TaskCompletion(document.getDocumentPath(), completed,
            mutation.getVersion(), allTasksComplete(after), after);
        LOG.info("Completed " + document.getDocumentPath() + "#" + completed.getSlug());
        return completion;
    }

    // -------------------------------------------------------------------------
    // Authoring
    // -------------------------------------------------------------------------

    /**
     * Adds a task as the last child of the Tasks section, or right after
     * {@code afterSlug}. A body without a status line gets {@code - Status: pending}.
     */
    public TaskRecord createTask(String rawPath, String title, String body, String afterSlug) {
        if (title == null || title.isBlank()) {
            throw AddressingException.missingParameter("title");
        }
        Address address = documents.resolver().resolve(rawPath).documentOnly();
        String normalized = SectionTree.normalizeBody(body);
        String content = TaskFields.extract(normalized, "Status").isPresent()
            ? normalized
            : "- Status: " + TaskStatus.PENDING.getValue() + (normalized.isEmpty() ? "" : "\n" + normalized);
        DocumentService.Mutation mutation = documents.mutate(address, tree -> {
            Heading tasksHeading = findTasksSection(tree).orElseThrow(() -> noTasksSection(address));
            int depth = Math.min(6, tasksHeading.getDepth() + 1);
            if (afterSlug != null && !afterSlug.isBlank()) {
                Heading anchor = requireTask(tree, afterSlug);
                return tree.insert(SectionOperation.INSERT_AFTER, anchor.getSlug(), title, content, depth);
            }
            return tree.insert(SectionOperation.APPEND_CHILD, tasksHeading.getSlug(), title, content, depth);
        });
        LOG.info("Created task " + address.getDocumentPath() + "#" + mutation.getEdit().getSlug());
        return recordAfter(mutation);
    }

    /** Replaces a task's section content (see {@link SectionTree#replace}). */
    public TaskRecord editTask(String rawDocument, String taskRef, String content) {
        if (content == null || content.isBlank()) {
            throw AddressingException.missingParameter("content");
        }
        Address document = documents.resolver().resolve(rawDocument).documentOnly();
        String slug = documents.resolver().resolveSection(taskRef, document).getSectionSlug();
        DocumentService.Mutation mutation = documents.mutate(document, tree -> {
            Heading task = requireTask(tree, slug);
            return tree.replace(task.getSlug(), content);
        });
        return recordAfter(mutation);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private Address resolveAdHoc(String rawAddress) {
        AddressResolver resolver = documents.resolver();
        Address address = resolver.requireFragment(resolver.resolve(rawAddress));
        if (address.getNamespace() != Namespace.DOCS) {
            throw new AddressingException(ErrorCode.NAMESPACE_VIOLATION,
                "Tasks addressed by slug must live outside " + address.getNamespace().getPrefix(),
                Map.of("path", address.getDocumentPath()));
        }
        return address;
    }

    static Heading requireTask(SectionTree tree, String ref) {
        Heading tasksHeading = findTasksSection(tree).orElseThrow(() ->
            new TaskStateException(ErrorCode.NO_TASKS_SECTION, "Document has no Tasks section"));
        List<Heading> tasks = tree.children(tasksHeading);
        Optional<Heading> found = tree.find(ref);
        if (found.isEmpty() || tasks.stream().noneMatch(h -> h.getIndex() == found.get().getIndex())) {
            throw new TaskStateException(ErrorCode.TASK_NOT_FOUND, "Task not found: " + ref,
                Map.of("slug", ref, "available", tasks.stream().map(Heading::getSlug).collect(Collectors.toList())));
        }
        return found.get();
    }

    private static void requireTransition(Heading task, TaskStatus current, TaskStatus next) {
        if (!current.canTransitionTo(next)) {
            throw new TaskStateException(ErrorCode.INVALID_TRANSITION,
                "Task '" + task.getSlug() + "' is " + current.getValue() + " and cannot become " + next.getValue(),
                Map.of("slug", task.getSlug(), "from", current.getValue(), "to", next.getValue()));
        }
    }

    private static TaskStateException noTasksSection(Address address) {
        return new TaskStateException(ErrorCode.NO_TASKS_SECTION,
            "No Tasks section in " + address.getDocumentPath(), Map.of("path", address.getDocumentPath()));
    }

    private static TaskRecord recordAfter(DocumentService.Mutation mutation) {
        SectionEdit edit = mutation.getEdit();
        SectionTree after = SectionTree.parse(edit.getContent());
        return toRecord(after, after.require(edit.getSlug()));
    }
}
