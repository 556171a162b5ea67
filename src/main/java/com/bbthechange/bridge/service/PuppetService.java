package com.bbthechange.bridge.service;

import com.bbthechange.bridge.model.Puppet;
import com.bbthechange.bridge.repository.PuppetRepository;
import com.bbthechange.bridge.util.KeyedLock;
import com.bbthechange.bridge.util.MxidTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Registry of puppets, cached in memory in front of the puppet store.
 *
 * Holds at most one Puppet instance per remote user key for the lifetime of the process.
 * Lookups by remote key serialize the check-load-create sequence per key, so concurrent callers
 * for the same key always get the same instance and the store sees a single insert. Lookups for
 * different keys run concurrently.
 *
 * Instances are never evicted. Field updates on a returned instance are not locked; callers
 * owning the instance mutate it and then persist it through {@link PuppetRepository#save}.
 */
@Service
public class PuppetService {

    private static final Logger logger = LoggerFactory.getLogger(PuppetService.class);
    private static final String CUSTOM_LOCK_PREFIX = "custom:";

    private final PuppetRepository puppetRepository;
    private final MxidTemplate mxidTemplate;
    private final KeyedLock keyedLock = new KeyedLock();

    private final Map<String, Puppet> byRemoteUserKey = new ConcurrentHashMap<>();
    private final Map<String, Puppet> byCustomMxid = new ConcurrentHashMap<>();

    public PuppetService(PuppetRepository puppetRepository, MxidTemplate mxidTemplate) {
        this.puppetRepository = puppetRepository;
        this.mxidTemplate = mxidTemplate;
    }

    public Optional<Puppet> getByRemoteKey(String remoteUserKey) {
        return getByRemoteKey(remoteUserKey, true);
    }

    /**
     * Find the puppet of a remote user, loading it from the store or creating it as needed.
     *
     * @param create whether to create and insert a new puppet when none exists
     * @return the canonical instance, or empty if it does not exist and {@code create} is false
     */
    public Optional<Puppet> getByRemoteKey(String remoteUserKey, boolean create) {
        Objects.requireNonNull(remoteUserKey, "remoteUserKey");
        return keyedLock.withLock(remoteUserKey, () -> {
            Puppet cached = byRemoteUserKey.get(remoteUserKey);
            if (cached != null) {
                return Optional.of(cached);
            }

            Optional<Puppet> stored = puppetRepository.findByRemoteUserKey(remoteUserKey);
            if (stored.isPresent()) {
                return Optional.of(addToCache(stored.get()));
            }

            if (!create) {
                return Optional.empty();
            }
            Puppet puppet = new Puppet(remoteUserKey);
            puppetRepository.insert(puppet);
            logger.info("Created puppet {} as {}", remoteUserKey, mxidTemplate.format(remoteUserKey));
            return Optional.of(addToCache(puppet));
        });
    }

    public Optional<Puppet> getByMxid(String mxid) {
        return getByMxid(mxid, true);
    }

    /**
     * Find the puppet behind a ghost mxid. Returns empty without touching the store when the mxid
     * is not one of this bridge's ghosts.
     */
    public Optional<Puppet> getByMxid(String mxid, boolean create) {
        Optional<String> remoteUserKey = mxidTemplate.parse(mxid);
        if (remoteUserKey.isEmpty()) {
            return Optional.empty();
        }
        return getByRemoteKey(remoteUserKey.get(), create);
    }

    /**
     * Find the puppet that a real Matrix account is double puppeting. Never creates.
     */
    public Optional<Puppet> getByCustomMxid(String customMxid) {
        Objects.requireNonNull(customMxid, "customMxid");
        return keyedLock.withLock(CUSTOM_LOCK_PREFIX + customMxid, () -> {
            Puppet cached = byCustomMxid.get(customMxid);
            if (cached != null) {
                return Optional.of(cached);
            }
            return puppetRepository.findByCustomMxid(customMxid).map(this::addToCache);
        });
    }

    /**
     * All double puppeted puppets in the store, resolved to their cached instances where one
     * exists. Each call runs a new store scan; the stream is lazy over the scan results.
     */
    public Stream<Puppet> getAllWithCustomMxid() {
        return puppetRepository.findAllWithCustomMxid().stream()
                .map(this::addToCache);
    }

    /**
     * Link a puppet to a real Matrix account, or unlink it when {@code customMxid} is null.
     * The sync position of the previous account is discarded.
     */
    public Puppet setCustomMxid(Puppet puppet, String customMxid) {
        String previous = puppet.getCustomMxid();
        if (Objects.equals(previous, customMxid)) {
            return puppet;
        }
        if (previous != null) {
            byCustomMxid.remove(previous, puppet);
        }
        puppet.setCustomMxid(customMxid);
        puppet.setSyncToken(null);
        if (customMxid != null) {
            byCustomMxid.put(customMxid, puppet);
        }
        puppetRepository.save(puppet);
        logger.info("Puppet {} custom mxid changed from {} to {}", puppet.getRemoteUserKey(), previous, customMxid);
        return puppet;
    }

    public String mxidFor(String remoteUserKey) {
        return mxidTemplate.format(remoteUserKey);
    }

    public String mxidFor(Puppet puppet) {
        return mxidTemplate.format(puppet.getRemoteUserKey());
    }

    public Optional<String> remoteKeyFor(String mxid) {
        return mxidTemplate.parse(mxid);
    }

    /**
     * Register a looked-up puppet in the caches. If another instance for the same remote key is
     * already cached, that one wins and is returned.
     */
    private Puppet addToCache(Puppet puppet) {
        Puppet existing = byRemoteUserKey.putIfAbsent(puppet.getRemoteUserKey(), puppet);
        Puppet canonical = existing != null ? existing : puppet;
        if (canonical.getCustomMxid() != null) {
            byCustomMxid.putIfAbsent(canonical.getCustomMxid(), canonical);
        }
        return canonical;
    }
}
