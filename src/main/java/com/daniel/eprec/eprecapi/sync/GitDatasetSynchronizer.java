package com.daniel.eprec.eprecapi.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import org.eclipse.jgit.api.Git; // Porcelain entry point (clone/open/fetch/merge).
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.errors.CheckoutConflictException; // Uncommitted local edits in the way of the checkout.
import org.eclipse.jgit.api.errors.GitAPIException; // Base of all porcelain command failures.
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils; // Recursive delete for a leftover staging clone.

import com.daniel.eprec.eprecapi.config.EprecProperties;

@Component
// Keeps repoRoot a clone of repoUrl's branch. Two states: no local copy (clone) and local copy (fetch + fast-forward).

public class GitDatasetSynchronizer implements DatasetSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(GitDatasetSynchronizer.class);
    private static final String STAGING_SUFFIX = ".staging";

    private final String repoUrl;
    private final Path repoRoot;
    private final String branch;
    private final String remoteName;

    @Autowired // Spring uses this one; the other constructor is for direct wiring in tests.
    public GitDatasetSynchronizer(EprecProperties properties) {
        this(properties.effectiveRepoUrl(),
                properties.repoRoot(),
                properties.effectiveBranch(),
                properties.effectiveRemoteName());
    }

    public GitDatasetSynchronizer(String repoUrl, Path repoRoot, String branch, String remoteName) {
        this.repoUrl = repoUrl;
        this.repoRoot = repoRoot;
        this.branch = branch;
        this.remoteName = remoteName;
    }

    public boolean hasLocalCopy() {
        return Files.exists(repoRoot);
    }

    Path stagingDir() {
        return repoRoot.resolveSibling(repoRoot.getFileName() + STAGING_SUFFIX);
    }

    @Override
    public Optional<PendingUpdate> prepare() throws DatasetSyncException {
        if (!hasLocalCopy()) {
            return Optional.of(stageClone());
        }
        return fetchRemoteHead();
    }

    /*
     * Clone into a sibling staging directory first; queries keep failing with "DB open error"
     * until the move, but they never see a half-cloned directory.
     */
    private PendingUpdate stageClone() throws DatasetSyncException {
        Path staging = stagingDir();
        try {
            FileSystemUtils.deleteRecursively(staging);
            Path parent = repoRoot.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ex) {
            throw new DatasetSyncException("Cannot prepare staging directory " + staging, ex);
        }

        log.info("Cloning {} ({}) into staging {}", repoUrl, branch, staging);
        try (Git git = Git.cloneRepository()
                .setURI(repoUrl)
                .setDirectory(staging.toFile())
                .setBranch(branch)
                .setRemote(remoteName)
                .call()) {
            ObjectId head = git.getRepository().resolve(Constants.HEAD);
            return new StagedClone(staging, head == null ? "empty" : head.abbreviate(8).name());
        } catch (GitAPIException | IOException ex) {
            deleteQuietly(staging);
            throw new DatasetSyncException("Clone of " + repoUrl + " failed: " + ex.getMessage(), ex);
        }
    }

    private Optional<PendingUpdate> fetchRemoteHead() throws DatasetSyncException {
        try (Git git = Git.open(repoRoot.toFile())) {
            git.fetch().setRemote(remoteName).call();

            Repository repository = git.getRepository();
            String remoteRef = Constants.R_REMOTES + remoteName + "/" + branch;
            ObjectId remoteHead = repository.resolve(remoteRef);
            if (remoteHead == null) {
                throw new DatasetSyncException("Remote branch " + remoteRef + " not found after fetch");
            }
            ObjectId localHead = repository.resolve(Constants.R_HEADS + branch);
            if (remoteHead.equals(localHead)) {
                return Optional.empty();
            }
            return Optional.of(new FastForward(remoteHead.copy(), remoteRef));
        } catch (GitAPIException | IOException ex) {
            throw new DatasetSyncException("Fetch from " + remoteName + " failed: " + ex.getMessage(), ex);
        }
    }

    private void deleteQuietly(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException cleanupEx) {
            log.warn("Could not remove staging directory {}: {}", dir, cleanupEx.getMessage());
        }
    }

    private final class StagedClone implements PendingUpdate {

        private final Path staging;
        private final String head;

        private StagedClone(Path staging, String head) {
            this.staging = staging;
            this.head = head;
        }

        @Override
        public String description() {
            return "initial clone at " + head;
        }

        @Override
        public RefreshOutcome apply() throws DatasetSyncException {
            try {
                Files.move(staging, repoRoot, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException ex) {
                deleteQuietly(staging);
                throw new DatasetSyncException("Cannot move staged clone into " + repoRoot, ex);
            }
            return RefreshOutcome.success("cloned " + repoUrl + " at " + head);
        }
    }

    private final class FastForward implements PendingUpdate {

        private final ObjectId target;
        private final String remoteRef;

        private FastForward(ObjectId target, String remoteRef) {
            this.target = target;
            this.remoteRef = remoteRef;
        }

        @Override
        public String description() {
            return "fast-forward to " + remoteRef + " " + target.abbreviate(8).name();
        }

        // Updates the branch and the working tree (data.db) together. Diverged history is left alone.
        @Override
        public RefreshOutcome apply() throws DatasetSyncException {
            try (Git git = Git.open(repoRoot.toFile())) {
                MergeResult result = git.merge()
                        .include(target)
                        .setFastForward(MergeCommand.FastForwardMode.FF_ONLY)
                        .call();
                switch (result.getMergeStatus()) {
                    case FAST_FORWARD:
                        return RefreshOutcome.success("fast-forwarded to " + target.abbreviate(8).name());
                    case ALREADY_UP_TO_DATE:
                        return RefreshOutcome.skipped("local " + branch + " already contains " + remoteRef);
                    case ABORTED:
                        // FF_ONLY aborts exactly when the local branch has commits the remote lacks.
                        throw new DatasetSyncException("Local " + branch + " diverged from " + remoteRef
                                + ", not reconciling");
                    default:
                        throw new DatasetSyncException("Fast-forward to " + remoteRef + " ended with "
                                + result.getMergeStatus()
                                + (result.getFailingPaths() == null ? "" : " on " + result.getFailingPaths().keySet()));
                }
            } catch (CheckoutConflictException ex) {
                throw new DatasetSyncException("Fast-forward to " + remoteRef + " blocked by local changes in "
                        + ex.getConflictingPaths(), ex);
            } catch (GitAPIException | IOException ex) {
                throw new DatasetSyncException("Fast-forward to " + remoteRef + " failed: " + ex.getMessage(), ex);
            }
        }
    }
}
