package com.astrazeneca.tbltransfer.modules;

import com.astrazeneca.tbltransfer.data.scopedata.AlignmentData;
import com.astrazeneca.tbltransfer.data.scopedata.MappingData;
import com.astrazeneca.tbltransfer.data.scopedata.Scope;
import com.astrazeneca.tbltransfer.mapper.CoordMapper;

/**
 * Builds the position tables of the aligned pair.
 */
public class CoordMapperBuilder implements Module<AlignmentData, MappingData> {

    @Override
    public Scope<MappingData> process(Scope<AlignmentData> scope) {
        CoordMapper mapper = CoordMapper.of(scope.data.alignment);
        return new Scope<>(scope, new MappingData(scope.data.pair, mapper));
    }
}
