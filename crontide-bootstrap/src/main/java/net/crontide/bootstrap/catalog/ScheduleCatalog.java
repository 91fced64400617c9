package net.crontide.bootstrap.catalog;

import net.crontide.core.model.ScheduleDef;
import net.crontide.core.model.SchedulePlan;
import net.crontide.core.service.ScheduleResolver;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** 이름 → 스케줄 정의. 계획(plan)은 조회할 때마다 새로 계산한다 */
public class ScheduleCatalog {
    private final ScheduleResolver resolver;
    private final Map<String, ScheduleDef> defs = new ConcurrentHashMap<>();

    public ScheduleCatalog(ScheduleResolver resolver) {
        this.resolver = resolver;
    }

    /** 같은 이름이 이미 있으면 IllegalStateException */
    public void register(ScheduleDef def) {
        registerAll(List.of(def));
    }

    /** 전부 등록하거나 하나도 등록하지 않는다. 목록 안이나 기존 항목과 이름이 겹치면 IllegalStateException */
    public synchronized void registerAll(List<ScheduleDef> batch) {
        Set<String> seen = new HashSet<>();
        for (ScheduleDef def : batch) {
            if (!seen.add(def.id()) || defs.containsKey(def.id())) {
                throw new IllegalStateException("Duplicate schedule name: " + def.id());
            }
        }
        for (ScheduleDef def : batch) {
            defs.put(def.id(), def);
        }
    }

    public Optional<ScheduleDef> find(String name) {
        return Optional.ofNullable(defs.get(name));
    }

    public List<String> names() {
        List<String> out = new ArrayList<>(defs.keySet());
        Collections.sort(out);
        return out;
    }

    public SchedulePlan plan(String name) {
        return resolver.resolve(require(name));
    }

    public SchedulePlan plan(String name, Instant now) {
        return resolver.resolve(require(name), now);
    }

    private ScheduleDef require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown schedule: " + name));
    }
}
