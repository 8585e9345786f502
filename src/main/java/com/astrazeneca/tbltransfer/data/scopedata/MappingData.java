package com.astrazeneca.tbltransfer.data.scopedata;

import com.astrazeneca.tbltransfer.data.ChromosomePair;
import com.astrazeneca.tbltransfer.mapper.CoordMapper;

public class MappingData {
    public final ChromosomePair pair;
    public final CoordMapper mapper;

    public MappingData(ChromosomePair pair, CoordMapper mapper) {
        this.pair = pair;
        this.mapper = mapper;
    }
}
