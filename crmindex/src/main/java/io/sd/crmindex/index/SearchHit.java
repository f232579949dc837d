package io.sd.crmindex.index;

import io.sd.crmindex.model.Entity;

public record SearchHit(Entity entity, double score) { }
